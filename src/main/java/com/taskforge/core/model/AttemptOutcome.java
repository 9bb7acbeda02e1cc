package com.taskforge.core.model;

/**
 * How a single attempt of a step at some tier ended.
 */
public enum AttemptOutcome {
    SUCCEEDED,
    HARD_FAILURE,
    SOFT_FAILURE,
    DECOMPOSED,
    RESOURCE_ERROR,
    CANCELLED
}
