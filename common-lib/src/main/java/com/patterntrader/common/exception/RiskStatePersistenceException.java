package com.patterntrader.common.exception;

/** Risk state could not be read or written. Never recovered by falling back to defaults. */
public class RiskStatePersistenceException extends TradingCoreException {

    public RiskStatePersistenceException(String message, Throwable cause) {
        super("RiskManager", message, cause);
    }

    public RiskStatePersistenceException(String message) {
        super("RiskManager", message);
    }
}
