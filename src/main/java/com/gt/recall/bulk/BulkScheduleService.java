package com.gt.recall.bulk;

import com.gt.recall.content.ContentDao;
import com.gt.recall.model.ReviewSchedule;
import com.gt.recall.schedule.ReviewSchedulerService;
import com.gt.recall.schedule.StoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Creates schedules for many items at once. Items are processed one by one: an item that fails is reported and the
 * rest of the batch carries on, and an item that already has a schedule is skipped rather than overwritten.
 */
@Component
public class BulkScheduleService {

    private static final Logger log = LoggerFactory.getLogger(BulkScheduleService.class);

    private final ReviewSchedulerService reviewSchedulerService;
    private final ContentDao contentDao;
    private final StoreRetry storeRetry;
    private final Clock clock;

    public BulkScheduleService(ReviewSchedulerService reviewSchedulerService, ContentDao contentDao, StoreRetry storeRetry,
                               Clock clock) {
        this.reviewSchedulerService = reviewSchedulerService;
        this.contentDao = contentDao;
        this.storeRetry = storeRetry;
        this.clock = clock;
    }

    public BulkScheduleResult bulkSchedule(BulkScheduleRequest request) {
        return bulkSchedule(request, () -> false);
    }

    /**
     * @param cancelled checked before each item, as is the thread's interrupt flag; items already scheduled stay
     *                  scheduled and the remainder is reported as not processed
     */
    public BulkScheduleResult bulkSchedule(BulkScheduleRequest request, BooleanSupplier cancelled) {
        List<String> itemIds = orderItems(new ArrayList<>(new LinkedHashSet<>(request.itemIds())), request.prioritizeBy());
        Instant baseDate = clock.instant().plus(request.initialDelay() == null ? Duration.ZERO : request.initialDelay());

        List<String> scheduled = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<BulkItemFailure> failed = new ArrayList<>();
        List<String> notProcessed = new ArrayList<>();
        boolean wasCancelled = false;

        for (int index = 0; index < itemIds.size(); index++) {
            String itemId = itemIds.get(index);

            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                wasCancelled = true;
                notProcessed.addAll(itemIds.subList(index, itemIds.size()));
                break;
            }

            try {
                Optional<ReviewSchedule> created = reviewSchedulerService.scheduleIfAbsent(itemId, request.userId(),
                        request.algorithm(), request.initialStrength(), dueDateFor(baseDate, index, request.distributeOverDays()));

                if (created.isPresent()) {
                    scheduled.add(itemId);
                } else {
                    skipped.add(itemId);
                }
            } catch (RuntimeException ex) {
                log.warn("Bulk scheduling failed for item {} and user {}: {}", itemId, request.userId(), ex.getMessage());
                failed.add(new BulkItemFailure(itemId, ex.getClass().getSimpleName(), ex.getMessage()));
            }
        }

        log.info("Bulk scheduled {} items for user {}: {} scheduled, {} skipped, {} failed, {} not processed{}",
                itemIds.size(), request.userId(), scheduled.size(), skipped.size(), failed.size(), notProcessed.size(),
                wasCancelled ? " (cancelled)" : "");

        return new BulkScheduleResult(scheduled, skipped, failed, notProcessed, wasCancelled);
    }

    // Stable sort, so equally important items keep their requested order. Unknown items go last.
    private List<String> orderItems(List<String> itemIds, BulkOrder order) {
        if (order != BulkOrder.IMPORTANCE || itemIds.size() < 2) {
            return itemIds;
        }

        Map<String, Double> importance = storeRetry.execute("loadImportance", () -> contentDao.loadImportance(itemIds));
        itemIds.sort(Comparator.comparingDouble((String itemId) -> importance.getOrDefault(itemId, 0.0)).reversed());

        return itemIds;
    }

    private static Instant dueDateFor(Instant baseDate, int index, int distributeOverDays) {
        if (distributeOverDays <= 1) {
            return baseDate;
        }
        return baseDate.plus(Duration.ofDays(index % distributeOverDays));
    }
}
