package com.patterntrader.orchestrator.client;

import com.patterntrader.common.model.TradeSignal;
import com.patterntrader.common.trade.Candle;
import com.patterntrader.orchestrator.client.dto.MonitorRequest;
import com.patterntrader.orchestrator.client.dto.MonitorResponse;
import com.patterntrader.orchestrator.client.dto.RiskStatusResponse;
import com.patterntrader.orchestrator.client.dto.SessionSummaryDTO;
import com.patterntrader.orchestrator.client.dto.SignalDecisionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * trade-service calls made during a session.
 *
 * <p>Unlike the feedback fetch, none of these fall back: trade-service owns trades and
 * risk state, so a failed call fails the session and it is not recorded as processed.
 */
@Component
public class TradeServiceClient {

    private static final Logger log = LoggerFactory.getLogger(TradeServiceClient.class);

    private final WebClient tradeClient;

    public TradeServiceClient(@Qualifier("tradeClient") WebClient tradeClient) {
        this.tradeClient = tradeClient;
    }

    public Mono<SignalDecisionResponse> submit(TradeSignal signal) {
        return tradeClient.post()
            .uri("/api/v1/trade/signals")
            .bodyValue(signal)
            .retrieve()
            .bodyToMono(SignalDecisionResponse.class)
            .doOnNext(d -> log.debug("Signal submitted. instrument={} horizon={} outcome={}",
                                     signal.instrument(), signal.horizonDays(), d.outcome()));
    }

    public Mono<MonitorResponse> monitor(List<Candle> candles) {
        return tradeClient.post()
            .uri("/api/v1/trade/monitor")
            .bodyValue(new MonitorRequest(candles))
            .retrieve()
            .bodyToMono(MonitorResponse.class);
    }

    public Mono<RiskStatusResponse> riskStatus() {
        return tradeClient.get()
            .uri("/api/v1/trade/risk")
            .retrieve()
            .bodyToMono(RiskStatusResponse.class);
    }

    /** Empty when no session was ever recorded (204). */
    public Mono<SessionSummaryDTO> lastSession() {
        return tradeClient.get()
            .uri("/api/v1/trade/sessions/last")
            .retrieve()
            .bodyToMono(SessionSummaryDTO.class);
    }

    public Mono<SessionSummaryDTO> recordSession(SessionSummaryDTO summary) {
        return tradeClient.post()
            .uri("/api/v1/trade/sessions/{date}", summary.sessionDate())
            .bodyValue(summary)
            .retrieve()
            .bodyToMono(SessionSummaryDTO.class);
    }
}
