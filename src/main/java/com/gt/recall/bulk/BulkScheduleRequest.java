package com.gt.recall.bulk;

import com.gt.recall.model.MemoryStrength;
import com.gt.recall.model.RepetitionAlgorithm;

import java.time.Duration;
import java.util.List;

/**
 * @param algorithm          algorithm for the new schedules, the configured default when null
 * @param initialStrength    starting strength, {@link MemoryStrength#initial()} when null
 * @param initialDelay       offset from now for the first due date, none when null
 * @param distributeOverDays when above 1, item i is further offset by {@code i % distributeOverDays} days
 * @param prioritizeBy       order in which items are scheduled, {@link BulkOrder#INPUT_ORDER} when null
 */
public record BulkScheduleRequest(List<String> itemIds,
                                  String userId,
                                  RepetitionAlgorithm algorithm,
                                  MemoryStrength initialStrength,
                                  Duration initialDelay,
                                  int distributeOverDays,
                                  BulkOrder prioritizeBy) {

    public BulkScheduleRequest {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (initialDelay != null && initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (distributeOverDays < 0) {
            throw new IllegalArgumentException("distributeOverDays must not be negative");
        }
        itemIds = itemIds == null ? List.of() : List.copyOf(itemIds);
        prioritizeBy = prioritizeBy == null ? BulkOrder.INPUT_ORDER : prioritizeBy;
    }

    public static BulkScheduleRequest immediate(List<String> itemIds, String userId, RepetitionAlgorithm algorithm) {
        return new BulkScheduleRequest(itemIds, userId, algorithm, null, null, 0, BulkOrder.INPUT_ORDER);
    }
}
