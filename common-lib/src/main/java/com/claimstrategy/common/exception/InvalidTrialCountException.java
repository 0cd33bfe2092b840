package com.claimstrategy.common.exception;

public class InvalidTrialCountException extends StrategyEngineException {

    public InvalidTrialCountException(long trials) {
        super("MonteCarloSimulator", "trial count must be a positive integer but was " + trials);
    }
}
