package com.patterntrader.common.exception;

public class TradingCoreException extends RuntimeException {
    private final String component;

    public TradingCoreException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public TradingCoreException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
