package com.patterntrader.common.exception;

/** Thrown from settings validation; stops the application context at startup. */
public class InvalidConfigurationException extends TradingCoreException {

    public InvalidConfigurationException(String settings, String message) {
        super(settings, message);
    }
}
