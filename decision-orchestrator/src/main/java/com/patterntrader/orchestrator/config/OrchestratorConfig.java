package com.patterntrader.orchestrator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.patterntrader.common.classifier.RegimeDetector;
import com.patterntrader.common.feedback.FeedbackBlender;
import com.patterntrader.common.prediction.PredictorSettings;
import com.patterntrader.orchestrator.pipeline.DecisionPipelineEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class OrchestratorConfig {

    @Value("${services.trade.base-url}")
    private String tradeUrl;

    @Value("${services.feedback.base-url}")
    private String feedbackUrl;

    @Bean
    public WebClient tradeClient(WebClient.Builder builder) {
        return builder.baseUrl(tradeUrl).build();
    }

    @Bean
    public WebClient feedbackClient(WebClient.Builder builder) {
        return builder.baseUrl(feedbackUrl).build();
    }

    @Bean
    public PredictorSettings predictorSettings(TradingProperties properties) {
        return properties.toPredictorSettings();
    }

    @Bean
    public RegimeDetector regimeDetector(TradingProperties properties) {
        return new RegimeDetector(properties.toRegimeSettings());
    }

    @Bean
    public DecisionPipelineEngine decisionPipelineEngine(TradingProperties properties,
                                                         PredictorSettings predictorSettings,
                                                         RegimeDetector regimeDetector) {
        return new DecisionPipelineEngine(
            new FeedbackBlender(properties.toBlendSettings(), predictorSettings),
            regimeDetector,
            properties.toHorizonPlans(),
            predictorSettings.stopLoss(),
            properties.toSizingSettings(),
            properties.toSignalFilter());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
