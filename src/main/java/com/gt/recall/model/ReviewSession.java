package com.gt.recall.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record ReviewSession(String sessionId,
                            String userId,
                            SessionStatus status,
                            Instant startedAt,
                            Instant endedAt,
                            List<String> itemsReviewed,
                            SessionStatistics statistics) {

    public ReviewSession {
        itemsReviewed = itemsReviewed == null ? List.of() : List.copyOf(itemsReviewed);
        statistics = statistics == null ? SessionStatistics.EMPTY : statistics;
    }

    public static ReviewSession start(String sessionId, String userId, Instant startedAt) {
        return new ReviewSession(sessionId, userId, SessionStatus.ACTIVE, startedAt, null, List.of(), SessionStatistics.EMPTY);
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public ReviewSession withReview(String itemId, Difficulty difficulty, Integer timeTakenSeconds, Double confidence) {
        List<String> newItemsReviewed = new ArrayList<>(itemsReviewed);
        newItemsReviewed.add(itemId);

        return new ReviewSession(sessionId, userId, status, startedAt, endedAt, newItemsReviewed,
                statistics.withReview(difficulty, timeTakenSeconds, confidence));
    }

    public ReviewSession end(Instant endInstant) {
        return new ReviewSession(sessionId, userId, SessionStatus.ENDED, startedAt, endInstant, itemsReviewed, statistics);
    }
}
