package com.taskforge.core.routing;

import com.taskforge.core.config.EngineProperties;
import com.taskforge.core.model.TaskStep;
import com.taskforge.core.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Routes steps using the {@code taskforge.routing} and {@code taskforge.tiers} settings.
 * <p>
 * The starting tier is the higher of the step's minimum tier and its category's configured
 * tier, moved up to the first enabled tier. Disabled tiers are skipped during escalation.
 */
public class DefaultTierRouter implements TierRouter {

    private static final Logger log = LoggerFactory.getLogger(DefaultTierRouter.class);

    private final EngineProperties properties;

    public DefaultTierRouter(EngineProperties properties) {
        this.properties = properties;
        boolean anyEnabled = false;
        for (Tier tier : Tier.values()) {
            anyEnabled |= properties.tier(tier).isEnabled();
        }
        if (!anyEnabled) {
            throw new IllegalStateException("At least one tier must be enabled");
        }
    }

    @Override
    public Tier initialTier(TaskStep step) {
        var routing = properties.getRouting();
        Tier configured = routing.getCategoryTiers().getOrDefault(step.category(), routing.getDefaultTier());
        Tier wanted = step.minimumTier() != null ? Tier.highest(configured, step.minimumTier()) : configured;
        for (Tier tier : Tier.values()) {
            if (tier.rank() >= wanted.rank() && properties.tier(tier).isEnabled()) {
                return tier;
            }
        }
        // Nothing enabled at or above the wanted tier; fall back to the highest enabled one
        Tier fallback = highestEnabled();
        log.warn("No enabled tier at or above {} for step {}, using {}", wanted, step.id(), fallback);
        return fallback;
    }

    @Override
    public Optional<Tier> nextTier(Tier current) {
        for (Tier tier : Tier.values()) {
            if (tier.isAbove(current) && properties.tier(tier).isEnabled()) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    @Override
    public double cost(Tier tier) {
        return properties.tier(tier).getCost();
    }

    private Tier highestEnabled() {
        Tier[] tiers = Tier.values();
        for (int i = tiers.length - 1; i >= 0; i--) {
            if (properties.tier(tiers[i]).isEnabled()) {
                return tiers[i];
            }
        }
        throw new IllegalStateException("No enabled tier");
    }
}
