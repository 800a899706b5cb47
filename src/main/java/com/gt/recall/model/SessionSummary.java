package com.gt.recall.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record SessionSummary(String sessionId,
                             String userId,
                             Instant startedAt,
                             Instant endedAt,
                             Duration elapsed,
                             List<String> itemsReviewed,
                             int reviewCount,
                             int correctCount,
                             double accuracyRate,
                             double averageConfidence,
                             double averageTimeSeconds,
                             int bestStreak,
                             SessionStatistics statistics) {

    public static SessionSummary fromEndedSession(ReviewSession session) {
        if (session.status() != SessionStatus.ENDED || session.endedAt() == null) {
            throw new IllegalStateException("Session " + session.sessionId() + " has not ended");
        }

        SessionStatistics stats = session.statistics();
        return new SessionSummary(
                session.sessionId(),
                session.userId(),
                session.startedAt(),
                session.endedAt(),
                Duration.between(session.startedAt(), session.endedAt()),
                session.itemsReviewed(),
                stats.totalReviewed(),
                stats.correctCount(),
                stats.accuracyRate(),
                stats.averageConfidence(),
                stats.averageTimeSeconds(),
                stats.bestStreak(),
                stats);
    }
}
