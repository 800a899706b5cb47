package com.gt.recall.session;

import com.gt.recall.exception.SessionClosedException;
import com.gt.recall.exception.SessionNotFoundException;
import com.gt.recall.model.Difficulty;
import com.gt.recall.model.RepetitionAlgorithm;
import com.gt.recall.model.ReviewOutcome;
import com.gt.recall.model.ReviewSchedule;
import com.gt.recall.model.ReviewSession;
import com.gt.recall.model.SessionSummary;
import com.gt.recall.notification.ReviewEventType;
import com.gt.recall.notification.ReviewNotification;
import com.gt.recall.notification.ReviewNotificationPublisher;
import com.gt.recall.schedule.ReviewSchedulerService;
import com.gt.recall.schedule.StoreRetry;
import com.gt.recall.util.KeyedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Review sessions move from ACTIVE to ENDED exactly once. Work on one session is serialized by a lock on the session
 * id, which is always taken before the scheduler's own item lock.
 */
@Component
public class ReviewSessionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionService.class);

    private final ReviewSessionDao reviewSessionDao;
    private final ReviewSchedulerService reviewSchedulerService;
    private final StoreRetry storeRetry;
    private final TransactionOperations transactionOperations;
    private final ReviewNotificationPublisher notificationPublisher;
    private final Clock clock;
    private final KeyedLocks sessionLocks;

    @Autowired
    public ReviewSessionService(ReviewSessionDao reviewSessionDao,
                                ReviewSchedulerService reviewSchedulerService,
                                StoreRetry storeRetry,
                                TransactionOperations transactionOperations,
                                ReviewNotificationPublisher notificationPublisher,
                                Clock clock,
                                @Value("${recall.scheduler.lockStripes:256}") int lockStripes) {
        this.reviewSessionDao = reviewSessionDao;
        this.reviewSchedulerService = reviewSchedulerService;
        this.storeRetry = storeRetry;
        this.transactionOperations = transactionOperations;
        this.notificationPublisher = notificationPublisher;
        this.clock = clock;

        this.sessionLocks = new KeyedLocks(lockStripes);
    }

    public String startSession(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }

        ReviewSession session = ReviewSession.start(UUID.randomUUID().toString(), userId, clock.instant());
        storeRetry.execute("startSession", () -> {
            reviewSessionDao.createSession(session);
            return null;
        });

        log.info("Started review session {} for user {}", session.sessionId(), userId);
        return session.sessionId();
    }

    public ReviewSession getSession(String sessionId) {
        return loadSession(requireSessionId(sessionId));
    }

    /**
     * Schedules the review through the scheduler, then adds the item and the outcome to the session aggregates.
     *
     * @throws SessionNotFoundException when the session does not exist
     * @throws SessionClosedException   when the session has ended
     */
    public ReviewSchedule recordReview(String sessionId, String itemId, RepetitionAlgorithm algorithm, Difficulty difficulty,
                                       Integer timeTakenSeconds, Double confidence) {
        requireSessionId(sessionId);
        Difficulty.require(difficulty);
        ReviewOutcome outcome = new ReviewOutcome(sessionId, timeTakenSeconds, confidence);

        return sessionLocks.withLock(sessionId, () -> {
            ReviewSession session = loadSession(sessionId);
            if (!session.isActive()) {
                throw new SessionClosedException("Session " + sessionId + " is " + session.status());
            }

            ReviewSchedule schedule = reviewSchedulerService.scheduleReview(itemId, session.userId(), algorithm, difficulty, outcome);

            // The item row and the aggregates commit together, and a retried append of the same position is a no-op
            int position = session.itemsReviewed().size();
            ReviewSession updated = session.withReview(itemId, difficulty, timeTakenSeconds, confidence);
            storeRetry.execute("recordSessionReview", () -> transactionOperations.execute(status -> {
                reviewSessionDao.appendSessionItem(sessionId, position, itemId);
                reviewSessionDao.saveSession(updated);
                return null;
            }));

            return schedule;
        });
    }

    // Calling this on an ended session returns the stored result and changes nothing
    public SessionSummary endSession(String sessionId) {
        requireSessionId(sessionId);

        return sessionLocks.withLock(sessionId, () -> {
            ReviewSession session = loadSession(sessionId);
            if (!session.isActive()) {
                return SessionSummary.fromEndedSession(session);
            }

            ReviewSession ended = session.end(clock.instant());
            storeRetry.execute("endSession", () -> {
                reviewSessionDao.saveSession(ended);
                return null;
            });

            SessionSummary summary = SessionSummary.fromEndedSession(ended);
            log.info("Ended review session {} for user {}: {} reviews, accuracy {}", sessionId, ended.userId(),
                    summary.reviewCount(), summary.accuracyRate());

            notificationPublisher.publish(new ReviewNotification(ReviewEventType.SESSION_ENDED, ended.userId(), null,
                    sessionId, ended.endedAt(), Map.of(
                            "reviewCount", summary.reviewCount(),
                            "accuracyRate", summary.accuracyRate(),
                            "elapsedSeconds", summary.elapsed().toSeconds())));

            return summary;
        });
    }

    public int endStaleSessions(Instant startedBefore) {
        int ended = 0;

        for (String sessionId : storeRetry.execute("loadStaleSessions",
                () -> reviewSessionDao.loadActiveSessionIdsStartedBefore(startedBefore))) {
            try {
                endSession(sessionId);
                ended++;
            } catch (RuntimeException ex) {
                log.warn("Unable to end stale session {}", sessionId, ex);
            }
        }

        return ended;
    }

    private static String requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new SessionNotFoundException("Session id is required");
        }

        return sessionId;
    }

    private ReviewSession loadSession(String sessionId) {
        return storeRetry.execute("loadSession", () -> reviewSessionDao.loadSession(sessionId))
                .orElseThrow(() -> new SessionNotFoundException("Session " + sessionId + " does not exist"));
    }
}
