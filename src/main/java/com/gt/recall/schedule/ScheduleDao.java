package com.gt.recall.schedule;

import com.gt.recall.model.ReviewSchedule;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ScheduleDao {

    Optional<ReviewSchedule> loadSchedule(String itemId, String userId);

    // Must be called inside a transaction; the row stays locked until it commits
    Optional<ReviewSchedule> loadScheduleForUpdate(String itemId, String userId);

    void saveSchedule(ReviewSchedule schedule);

    boolean createScheduleIfAbsent(ReviewSchedule schedule);

    List<ReviewSchedule> loadDueSchedules(String userId, Instant asOf);

    long countDueSchedules(String userId, Instant cutoff);

    // Current interval of each of the user's schedules, keyed by item id
    Map<String, Integer> loadIntervalDays(String userId);

    int archiveItem(String itemId);
}
