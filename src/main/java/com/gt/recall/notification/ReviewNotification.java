package com.gt.recall.notification;

import java.time.Instant;
import java.util.Map;

public record ReviewNotification(ReviewEventType type,
                                 String userId,
                                 String itemId,
                                 String sessionId,
                                 Instant occurredAt,
                                 Map<String, Object> payload) {

    public ReviewNotification {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
