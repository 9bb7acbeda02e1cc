package com.taskforge.core.agent;

import com.taskforge.core.model.Tier;

import java.util.Objects;

/**
 * Exactly one backend per tier. Selection is an exhaustive switch over {@link Tier}, so
 * adding a tier does not compile until it is wired here.
 */
public class AgentBackends {

    private final AgentBackend local;
    private final AgentBackend mid;
    private final AgentBackend premium;

    public AgentBackends(AgentBackend local, AgentBackend mid, AgentBackend premium) {
        this.local = Objects.requireNonNull(local, "local");
        this.mid = Objects.requireNonNull(mid, "mid");
        this.premium = Objects.requireNonNull(premium, "premium");
    }

    /** Uses the same backend for every tier. */
    public static AgentBackends uniform(AgentBackend backend) {
        return new AgentBackends(backend, backend, backend);
    }

    public AgentBackend forTier(Tier tier) {
        return switch (tier) {
            case LOCAL -> local;
            case MID -> mid;
            case PREMIUM -> premium;
        };
    }
}
