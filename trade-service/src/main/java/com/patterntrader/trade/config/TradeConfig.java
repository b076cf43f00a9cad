package com.patterntrader.trade.config;

import com.patterntrader.common.risk.RiskLimits;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class TradeConfig {

    @Value("${services.feedback.base-url}")
    private String feedbackUrl;

    @Value("${services.notification.base-url}")
    private String notificationUrl;

    @Bean
    public WebClient feedbackWebClient(WebClient.Builder builder) {
        return builder.baseUrl(feedbackUrl).build();
    }

    @Bean
    public WebClient notificationWebClient(WebClient.Builder builder) {
        return builder.baseUrl(notificationUrl).build();
    }

    @Bean
    public RiskLimits riskLimits(RiskProperties properties) {
        return properties.toLimits();
    }

    @Bean
    public ZoneId tradingZone(RiskProperties properties) {
        return ZoneId.of(properties.getZone());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
