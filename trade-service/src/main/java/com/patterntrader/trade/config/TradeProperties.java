package com.patterntrader.trade.config;

import com.patterntrader.common.exception.InvalidConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalTime;

@Data
@ConfigurationProperties(prefix = "trade")
public class TradeProperties {

    /** Round-trip cost subtracted from every realized return, in percent. */
    private double roundTripCostPct = 0.05;

    /** Exchange close; a candle-driven exit is timestamped at this local time. */
    @DateTimeFormat(pattern = "HH:mm")
    private LocalTime sessionClose = LocalTime.of(15, 30);

    public TradeProperties validated() {
        if (roundTripCostPct < 0)
            throw new InvalidConfigurationException("TradeProperties", "roundTripCostPct must be >= 0");
        return this;
    }
}
