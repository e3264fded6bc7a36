package com.herzen.coach.strategy;

/**
 * Raised when a strategy name does not match any registered strategy.
 */
public class StrategyNotFoundException extends RuntimeException {
    private final String strategyName;

    public StrategyNotFoundException(String strategyName) {
        super("Strategy not found: " + strategyName);
        this.strategyName = strategyName;
    }

    public String getStrategyName() {
        return strategyName;
    }
}
