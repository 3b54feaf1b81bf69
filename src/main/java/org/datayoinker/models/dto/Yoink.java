package org.datayoinker.models.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Map;

/**
 * A persisted reading as returned to clients, with its content decoded into typed values.
 */
@JsonPropertyOrder({"id", "topic", "timestamp", "content"})
public record Yoink(
        long id,
        String topic,
        Instant timestamp,
        Map<String, Object> content
) {

    private static final Yoink EMPTY = new Yoink(0L, "", null, Map.of());

    /**
     * Placeholder returned by a latest lookup on a topic without records.
     */
    public static Yoink empty() {
        return EMPTY;
    }
}
