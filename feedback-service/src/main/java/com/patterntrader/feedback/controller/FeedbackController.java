package com.patterntrader.feedback.controller;

import com.patterntrader.common.feedback.FeedbackSnapshot;
import com.patterntrader.common.feedback.OutcomeRecord;
import com.patterntrader.feedback.dto.IngestResult;
import com.patterntrader.feedback.service.FeedbackIngestionService;
import com.patterntrader.feedback.service.FeedbackSnapshotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/feedback")
public class FeedbackController {

    private static final Logger log = LoggerFactory.getLogger(FeedbackController.class);

    private final FeedbackIngestionService ingestionService;
    private final FeedbackSnapshotService snapshotService;

    public FeedbackController(FeedbackIngestionService ingestionService, FeedbackSnapshotService snapshotService) {
        this.ingestionService = ingestionService;
        this.snapshotService  = snapshotService;
    }

    @PostMapping("/outcomes")
    public Mono<ResponseEntity<IngestResult>> ingest(@RequestBody OutcomeRecord outcome) {
        log.info("Outcome received. tradeId={} pattern={} horizon={} return={}",
                 outcome.tradeId(), outcome.pattern(), outcome.horizon(), outcome.returnPct());
        return ingestionService.ingest(outcome)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/snapshot")
    public Mono<ResponseEntity<FeedbackSnapshot>> snapshot() {
        return snapshotService.current()
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
