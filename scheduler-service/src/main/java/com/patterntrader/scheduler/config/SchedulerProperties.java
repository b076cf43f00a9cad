package com.patterntrader.scheduler.config;

import com.patterntrader.common.exception.InvalidConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

@Data
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private boolean enabled = true;

    /** Exchange zone; the session time below is local to it. */
    private String zone = "Asia/Kolkata";

    /** Local time after the close at which the day's session is run. */
    @DateTimeFormat(pattern = "HH:mm")
    private LocalTime sessionTime = LocalTime.of(15, 45);

    /** Run a catch-up shortly after startup instead of waiting for the next session time. */
    private boolean catchUpOnStartup = true;

    private Duration startupDelay = Duration.ofSeconds(30);

    /** Wait before retrying a failed catch-up. */
    private Duration retryInterval = Duration.ofMinutes(15);

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public SchedulerProperties validated() {
        if (sessionTime == null)
            throw new InvalidConfigurationException("SchedulerProperties", "sessionTime is required");
        if (startupDelay == null || startupDelay.isNegative())
            throw new InvalidConfigurationException("SchedulerProperties", "startupDelay must be >= 0");
        if (retryInterval == null || retryInterval.isZero() || retryInterval.isNegative())
            throw new InvalidConfigurationException("SchedulerProperties", "retryInterval must be positive");
        try {
            zoneId();
        } catch (DateTimeException e) {
            throw new InvalidConfigurationException("SchedulerProperties", "unknown zone " + zone);
        }
        return this;
    }
}
