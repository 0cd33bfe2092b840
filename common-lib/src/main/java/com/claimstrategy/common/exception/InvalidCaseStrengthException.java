package com.claimstrategy.common.exception;

/**
 * Raised by the strict {@code CaseStrength} factory. The analysis entry point
 * clamps instead and logs a warning.
 */
public class InvalidCaseStrengthException extends StrategyEngineException {

    public InvalidCaseStrengthException(int value) {
        super("CaseStrength", "case strength must lie in [0, 10] but was " + value);
    }
}
