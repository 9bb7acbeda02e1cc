package com.taskforge.core.model;

import java.io.Serializable;

/**
 * One entry of a step's tier history.
 *
 * @param attempt   1-based attempt number across the whole step
 * @param tier      tier the attempt ran on
 * @param outcome   how the attempt ended
 * @param detail    error text or verification output (nullable)
 * @param elapsedMs wall-clock time of the attempt
 */
public record TierAttempt(
    int attempt,
    Tier tier,
    AttemptOutcome outcome,
    String detail,
    long elapsedMs
) implements Serializable {}
