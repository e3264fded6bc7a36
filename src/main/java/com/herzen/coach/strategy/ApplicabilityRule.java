package com.herzen.coach.strategy;

import com.herzen.coach.context.ContextModels.UserContext;

/**
 * Pure predicate deciding whether a strategy may be offered for a context.
 */
@FunctionalInterface
public interface ApplicabilityRule {
    boolean appliesTo(UserContext context);
}
