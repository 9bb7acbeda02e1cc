package com.taskforge.core.agent;

import com.taskforge.core.error.HardFailureException;
import com.taskforge.core.model.Tier;

/**
 * Placeholder for a tier with no configured command. Every call fails as unreachable,
 * which makes the step escalate past the tier once its retries are spent.
 */
public class UnavailableAgentBackend implements AgentBackend {

    private final Tier tier;

    public UnavailableAgentBackend(Tier tier) {
        this.tier = tier;
    }

    @Override
    public StepOutcome execute(AgentRequest request) {
        throw new HardFailureException(HardFailureException.Reason.UNREACHABLE,
                "No agent command configured for tier " + tier);
    }

    @Override
    public String name() {
        return "unavailable-" + tier.name().toLowerCase();
    }
}
