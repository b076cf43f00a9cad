package com.patterntrader.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Realized forward outcome of one observation over one horizon.
 *
 * @param forwardReturn  percent return from the observation close to the horizon close
 * @param direction      realized direction label
 * @param maxFavorable   max favorable excursion in percent, null when not computed
 * @param maxAdverse     max adverse excursion in percent (negative), null when not computed
 */
public record HorizonOutcome(
    @JsonProperty("forwardReturn") double forwardReturn,
    @JsonProperty("direction")     Direction direction,
    @JsonProperty("maxFavorable")  Double maxFavorable,
    @JsonProperty("maxAdverse")    Double maxAdverse
) {}
