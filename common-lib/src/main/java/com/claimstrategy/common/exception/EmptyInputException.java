package com.claimstrategy.common.exception;

/**
 * Raised by the statistics utilities on an empty sample.
 *
 * <p>Inside the engine this only happens if the scenario catalog or a trial
 * array is empty, which a positive trial count rules out. Treat it as a broken
 * invariant, not a recoverable condition.
 */
public class EmptyInputException extends StrategyEngineException {

    public EmptyInputException(String operation) {
        super("OutcomeStatistics", operation + " requires at least one value");
    }
}
