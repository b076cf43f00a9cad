package com.patterntrader.notification.controller;

import com.patterntrader.common.model.AlertMessage;
import com.patterntrader.notification.sender.SlackWebhookSender;
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
@RequestMapping("/api/v1/notify")
public class NotificationController {

    private static final Logger log = LoggerFactory.getLogger(NotificationController.class);

    private final SlackWebhookSender slackSender;

    public NotificationController(SlackWebhookSender slackSender) {
        this.slackSender = slackSender;
    }

    @PostMapping("/alert")
    public Mono<ResponseEntity<Void>> alert(@RequestBody AlertMessage alert) {
        if (isBlank(alert.kind()) || isBlank(alert.title())) {
            log.warn("Alert rejected: kind and title are required. kind={}", alert.kind());
            return Mono.just(ResponseEntity.badRequest().build());
        }
        log.info("Alert received. kind={} severity={}", alert.kind(), alert.severity());
        return slackSender.send(alert)
            .then(Mono.just(ResponseEntity.accepted().<Void>build()));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
