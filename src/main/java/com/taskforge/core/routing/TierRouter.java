package com.taskforge.core.routing;

import com.taskforge.core.model.TaskStep;
import com.taskforge.core.model.Tier;

import java.util.Optional;

/**
 * Side-effect-free routing policy: where a step starts, where it escalates to, and what
 * an attempt on a tier costs.
 */
public interface TierRouter {

    Tier initialTier(TaskStep step);

    /** The next tier to escalate to, or empty when {@code current} is the highest available. */
    Optional<Tier> nextTier(Tier current);

    double cost(Tier tier);
}
