package com.claimstrategy.common.exception;

/**
 * Root of every failure raised by the strategy engine.
 *
 * <p>Carries the name of the component that rejected the input so callers can
 * surface it without parsing the message.
 */
public class StrategyEngineException extends RuntimeException {
    private final String component;

    public StrategyEngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
