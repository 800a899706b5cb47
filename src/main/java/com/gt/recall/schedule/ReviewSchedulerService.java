package com.gt.recall.schedule;

import com.gt.recall.algorithm.AlgorithmRegistry;
import com.gt.recall.algorithm.SchedulingAlgorithm;
import com.gt.recall.algorithm.SchedulingAlgorithm.AlgorithmResult;
import com.gt.recall.content.ContentDao;
import com.gt.recall.exception.ItemNotFoundException;
import com.gt.recall.exception.ScheduleNotFoundException;
import com.gt.recall.history.ReviewHistoryDao;
import com.gt.recall.model.Difficulty;
import com.gt.recall.model.DueReview;
import com.gt.recall.model.MemoryStrength;
import com.gt.recall.model.RepetitionAlgorithm;
import com.gt.recall.model.ReviewHistory;
import com.gt.recall.model.ReviewOutcome;
import com.gt.recall.model.ReviewSchedule;
import com.gt.recall.model.ScheduleStatus;
import com.gt.recall.notification.ReviewEventType;
import com.gt.recall.notification.ReviewNotification;
import com.gt.recall.notification.ReviewNotificationPublisher;
import com.gt.recall.util.KeyedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Applies reviews to schedules and answers due-item queries.
 *
 * <p>Each review is a read-modify-write on the (item, user) schedule. It runs under an in-process lock for that
 * key and inside a transaction that reads the row {@code FOR UPDATE}, so concurrent reviews of the same pair are
 * applied one after the other. Reviews of different pairs only share a lock stripe by chance.
 */
@Component
public class ReviewSchedulerService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSchedulerService.class);

    private final ScheduleDao scheduleDao;
    private final ReviewHistoryDao reviewHistoryDao;
    private final ContentDao contentDao;
    private final AlgorithmRegistry algorithmRegistry;
    private final ReviewPriorityCalculator priorityCalculator;
    private final StoreRetry storeRetry;
    private final TransactionOperations transactionOperations;
    private final ReviewNotificationPublisher notificationPublisher;
    private final Clock clock;
    private final RepetitionAlgorithm defaultAlgorithm;
    private final int maxDueItems;
    private final KeyedLocks scheduleLocks;

    @Autowired
    public ReviewSchedulerService(ScheduleDao scheduleDao,
                                  ReviewHistoryDao reviewHistoryDao,
                                  ContentDao contentDao,
                                  AlgorithmRegistry algorithmRegistry,
                                  ReviewPriorityCalculator priorityCalculator,
                                  StoreRetry storeRetry,
                                  TransactionOperations transactionOperations,
                                  ReviewNotificationPublisher notificationPublisher,
                                  Clock clock,
                                  @Value("${recall.scheduler.defaultAlgorithm:SM2}") RepetitionAlgorithm defaultAlgorithm,
                                  @Value("${recall.scheduler.maxDueItems:999}") int maxDueItems,
                                  @Value("${recall.scheduler.lockStripes:256}") int lockStripes) {
        this.scheduleDao = scheduleDao;
        this.reviewHistoryDao = reviewHistoryDao;
        this.contentDao = contentDao;
        this.algorithmRegistry = algorithmRegistry;
        this.priorityCalculator = priorityCalculator;
        this.storeRetry = storeRetry;
        this.transactionOperations = transactionOperations;
        this.notificationPublisher = notificationPublisher;
        this.clock = clock;

        this.defaultAlgorithm = defaultAlgorithm;
        this.maxDueItems = maxDueItems;
        this.scheduleLocks = new KeyedLocks(lockStripes);
    }

    /**
     * Applies one review to the item's schedule, creating the schedule on first review.
     *
     * @param algorithm algorithm to apply; when null the schedule's current algorithm is used, or the configured
     *                  default for a first review
     * @param outcome   optional session, timing and confidence metadata recorded in the history
     */
    public ReviewSchedule scheduleReview(String itemId, String userId, RepetitionAlgorithm algorithm,
                                         Difficulty difficulty, ReviewOutcome outcome) {
        Difficulty.require(difficulty);
        ReviewOutcome metadata = outcome == null ? ReviewOutcome.NONE : outcome;
        requireItem(itemId);

        AppliedReview applied = scheduleLocks.withLock(new ScheduleKey(itemId, userId),
                () -> storeRetry.execute("scheduleReview",
                        () -> transactionOperations.execute(status -> applyReview(itemId, userId, algorithm, difficulty, metadata))));

        ReviewSchedule schedule = applied.schedule();
        log.debug("Review {} of item {} for user {} with {} due {} interval {} ease {}", difficulty, itemId, userId,
                schedule.algorithm(), schedule.scheduledDate(), schedule.strength().intervalDays(), schedule.strength().easeFactor());

        notify(ReviewEventType.REVIEW_COMPLETED, schedule, metadata.sessionId(), Map.of(
                "difficulty", difficulty.toString(),
                "nextDue", schedule.scheduledDate().toString(),
                "earliestDate", schedule.earliestDate().toString(),
                "latestDate", schedule.latestDate().toString(),
                "intervalDays", schedule.strength().intervalDays()));
        if (applied.newLeech()) {
            log.info("Item {} flagged as a leech for user {} after {} consecutive lapses", itemId, userId, schedule.strength().lapseStreak());
            notify(ReviewEventType.LEECH_DETECTED, schedule, metadata.sessionId(), Map.of(
                    "lapseStreak", schedule.strength().lapseStreak()));
        }

        return schedule;
    }

    private AppliedReview applyReview(String itemId, String userId, RepetitionAlgorithm requestedAlgorithm,
                                      Difficulty difficulty, ReviewOutcome outcome) {
        Optional<ReviewSchedule> existing = scheduleDao.loadScheduleForUpdate(itemId, userId);

        RepetitionAlgorithm algorithmId = requestedAlgorithm != null
                ? requestedAlgorithm
                : existing.map(ReviewSchedule::algorithm).orElse(defaultAlgorithm);
        SchedulingAlgorithm algorithm = algorithmRegistry.require(algorithmId);
        MemoryStrength current = existing.map(ReviewSchedule::strength).orElseGet(MemoryStrength::initial);
        boolean wasLeech = existing.map(ReviewSchedule::leech).orElse(false);

        Instant reviewedAt = clock.instant();
        AlgorithmResult result = algorithm.apply(current, difficulty, reviewedAt);

        ReviewSchedule updated = new ReviewSchedule(itemId, userId, result.nextDue(), algorithmId, ScheduleStatus.ACTIVE,
                result.strength(), result.leech());
        scheduleDao.saveSchedule(updated);
        reviewHistoryDao.appendHistory(new ReviewHistory(itemId, userId, outcome.sessionId(), algorithmId, difficulty,
                outcome.timeTakenSeconds(), outcome.confidence(), reviewedAt));

        return new AppliedReview(updated, result.leech() && !wasLeech);
    }

    /**
     * Due items ordered by descending priority, then oldest due date, then item id.
     *
     * @param limit maximum items to return; values below 1 or above the configured maximum use the maximum
     */
    public List<DueReview> getDueItems(String userId, Instant asOf, int limit) {
        Instant cutoff = asOf == null ? clock.instant() : asOf;
        int effectiveLimit = limit < 1 || limit > maxDueItems ? maxDueItems : limit;

        List<ReviewSchedule> dueSchedules = storeRetry.execute("getDueItems",
                () -> scheduleDao.loadDueSchedules(userId, cutoff));

        return dueSchedules.stream()
                .filter(schedule -> schedule.isDue(cutoff))
                .map(schedule -> priorityCalculator.toDueReview(schedule, cutoff))
                .sorted(ReviewPriorityCalculator.DUE_ORDER)
                .limit(effectiveLimit)
                .toList();
    }

    // Only the algorithm changes; ease, interval and due date carry over to the next review
    public ReviewSchedule reschedule(String itemId, String userId, RepetitionAlgorithm newAlgorithm) {
        algorithmRegistry.require(newAlgorithm);

        ReviewSchedule updated = updateExisting(itemId, userId, "reschedule", schedule -> schedule.withAlgorithm(newAlgorithm));
        log.info("Switched item {} for user {} to {}", itemId, userId, newAlgorithm);

        return updated;
    }

    public ReviewSchedule suspend(String itemId, String userId) {
        ReviewSchedule updated = updateExisting(itemId, userId, "suspend", schedule -> schedule.withStatus(ScheduleStatus.SUSPENDED));
        log.info("Suspended item {} for user {}", itemId, userId);

        return updated;
    }

    public ReviewSchedule resume(String itemId, String userId) {
        ReviewSchedule updated = updateExisting(itemId, userId, "resume", schedule -> schedule.withStatus(ScheduleStatus.ACTIVE));
        log.info("Resumed item {} for user {}", itemId, userId);

        return updated;
    }

    private ReviewSchedule updateExisting(String itemId, String userId, String operation,
                                          UnaryOperator<ReviewSchedule> change) {
        return scheduleLocks.withLock(new ScheduleKey(itemId, userId),
                () -> storeRetry.execute(operation, () -> transactionOperations.execute(status -> {
                    ReviewSchedule existing = scheduleDao.loadScheduleForUpdate(itemId, userId)
                            .orElseThrow(() -> new ScheduleNotFoundException("No schedule for item " + itemId + " and user " + userId));

                    ReviewSchedule updated = change.apply(existing);
                    scheduleDao.saveSchedule(updated);
                    return updated;
                })));
    }

    // Archives every user's schedule for an item that was removed from the content store
    public int archiveItem(String itemId) {
        int archived = storeRetry.execute("archiveItem", () -> scheduleDao.archiveItem(itemId));
        log.info("Archived {} schedules for item {}", archived, itemId);

        return archived;
    }

    public Optional<MemoryStrength> getStrength(String itemId, String userId) {
        return getSchedule(itemId, userId).map(ReviewSchedule::strength);
    }

    public Optional<ReviewSchedule> getSchedule(String itemId, String userId) {
        return storeRetry.execute("getSchedule", () -> scheduleDao.loadSchedule(itemId, userId));
    }

    /**
     * Due date each difficulty would produce if the item were reviewed now. Nothing is persisted.
     *
     * @param algorithm algorithm to preview; when null the schedule's own algorithm, or the default for a new item
     */
    public Map<Difficulty, Instant> previewNextDue(String itemId, String userId, RepetitionAlgorithm algorithm) {
        Optional<ReviewSchedule> existing = getSchedule(itemId, userId);

        RepetitionAlgorithm algorithmId = algorithm != null
                ? algorithm
                : existing.map(ReviewSchedule::algorithm).orElse(defaultAlgorithm);
        MemoryStrength current = existing.map(ReviewSchedule::strength).orElseGet(MemoryStrength::initial);

        return algorithmRegistry.require(algorithmId).previewNextDue(current, clock.instant());
    }

    /**
     * Creates a schedule for an item the user has never reviewed. An existing schedule is left untouched.
     *
     * @return the new schedule, or empty when one already existed
     */
    public Optional<ReviewSchedule> scheduleIfAbsent(String itemId, String userId, RepetitionAlgorithm algorithm,
                                                     MemoryStrength initialStrength, Instant scheduledDate) {
        RepetitionAlgorithm algorithmId = algorithm == null ? defaultAlgorithm : algorithm;
        algorithmRegistry.require(algorithmId);
        requireItem(itemId);

        ReviewSchedule schedule = new ReviewSchedule(itemId, userId, scheduledDate, algorithmId, ScheduleStatus.ACTIVE,
                initialStrength == null ? MemoryStrength.initial() : initialStrength, false);

        boolean created = scheduleLocks.withLock(new ScheduleKey(itemId, userId),
                () -> storeRetry.execute("scheduleIfAbsent", () -> scheduleDao.createScheduleIfAbsent(schedule)));
        if (!created) {
            return Optional.empty();
        }

        notify(ReviewEventType.REVIEW_SCHEDULED, schedule, null, Map.of("nextDue", scheduledDate.toString()));
        return Optional.of(schedule);
    }

    public List<ReviewHistory> getItemHistory(String itemId, String userId) {
        return storeRetry.execute("getItemHistory", () -> reviewHistoryDao.loadItemHistory(itemId, userId));
    }

    private void requireItem(String itemId) {
        boolean exists = storeRetry.execute("itemExists", () -> contentDao.itemExists(itemId));
        if (!exists) {
            throw new ItemNotFoundException("Item " + itemId + " does not exist");
        }
    }

    private void notify(ReviewEventType type, ReviewSchedule schedule, String sessionId, Map<String, Object> payload) {
        notificationPublisher.publish(new ReviewNotification(type, schedule.userId(), schedule.itemId(), sessionId,
                clock.instant(), payload));
    }

    private record ScheduleKey(String itemId, String userId) { }

    private record AppliedReview(ReviewSchedule schedule, boolean newLeech) { }
}
