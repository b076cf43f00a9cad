package com.patterntrader.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Operator alert sent to the notification service.
 *
 * @param kind    {@code breaker_tripped}, {@code trade_closed}, {@code session_failed}, ...
 * @param fields  key/value details rendered under the title
 */
public record AlertMessage(
    @JsonProperty("kind")     String kind,
    @JsonProperty("severity") String severity,
    @JsonProperty("title")    String title,
    @JsonProperty("fields")   Map<String, String> fields
) {

    public static final String BREAKER_TRIPPED = "breaker_tripped";
    public static final String TRADE_CLOSED    = "trade_closed";
    public static final String SESSION_FAILED  = "session_failed";

    public AlertMessage {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    /** Slack-style text: title on the first line, then one {@code key: value} line per field. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(severity).append("] ").append(title);
        fields.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> sb.append("\n").append(e.getKey()).append(": ").append(e.getValue()));
        return sb.toString();
    }
}
