package com.claimstrategy.common.exception;

/**
 * Raised when a damages range is not ordered
 * {@code conservative <= recommended <= aggressive}, or holds a negative or
 * non-finite amount.
 */
public class InvalidDamagesRangeException extends StrategyEngineException {

    public InvalidDamagesRangeException(String message) {
        super("DamagesRange", message);
    }
}
