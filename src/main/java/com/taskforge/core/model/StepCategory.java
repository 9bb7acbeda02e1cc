package com.taskforge.core.model;

/**
 * Kind of work a step performs. Selects the default verification command.
 */
public enum StepCategory {
    DEBUG,
    FEATURE,
    REFACTOR,
    VERIFY,
    TEST;

    /**
     * Returns the command that must exit 0 for a step of this category to be accepted,
     * unless the step or the configuration overrides it.
     */
    public String defaultVerificationCommand() {
        return switch (this) {
            case DEBUG, FEATURE, VERIFY -> "cargo check";
            case REFACTOR -> "cargo clippy -- -D warnings";
            case TEST -> "cargo test";
        };
    }
}
