package com.taskforge.core.model;

/**
 * Execution backend ranked by cost and capability. Escalation only ever moves to a higher rank.
 */
public enum Tier {
    LOCAL(0),
    MID(1),
    PREMIUM(2);

    private final int rank;

    Tier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isAbove(Tier other) {
        return rank > other.rank;
    }

    public static Tier highest(Tier a, Tier b) {
        return a.rank >= b.rank ? a : b;
    }
}
