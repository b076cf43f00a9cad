package com.patterntrader.orchestrator.service;

import com.patterntrader.common.exception.TradingCoreException;

/** A second run was requested while one is still writing signals. */
public class SessionInProgressException extends TradingCoreException {

    public SessionInProgressException() {
        super("SessionService", "a session run is already in progress");
    }
}
