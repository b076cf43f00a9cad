package com.patterntrader.common.risk;

/** Minimal view of an open trade needed by the pre-entry gates. */
public record OpenPosition(String instrument, String sector, int horizonDays) {}
