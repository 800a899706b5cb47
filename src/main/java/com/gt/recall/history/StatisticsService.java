package com.gt.recall.history;

import com.gt.recall.model.Difficulty;
import com.gt.recall.model.LearningStatistics;
import com.gt.recall.model.RepetitionAlgorithm;
import com.gt.recall.model.ReviewHistory;
import com.gt.recall.model.StatisticsWindow;
import com.gt.recall.schedule.ScheduleDao;
import com.gt.recall.schedule.StoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

// Read-only aggregation over review history. Calendar days are UTC days.
@Component
public class StatisticsService {

    private static final Logger log = LoggerFactory.getLogger(StatisticsService.class);

    private final ReviewHistoryDao reviewHistoryDao;
    private final ScheduleDao scheduleDao;
    private final StoreRetry storeRetry;
    private final Clock clock;

    public StatisticsService(ReviewHistoryDao reviewHistoryDao, ScheduleDao scheduleDao, StoreRetry storeRetry, Clock clock) {
        this.reviewHistoryDao = reviewHistoryDao;
        this.scheduleDao = scheduleDao;
        this.storeRetry = storeRetry;
        this.clock = clock;
    }

    public LearningStatistics getStatistics(String userId, StatisticsWindow window) {
        StatisticsWindow effectiveWindow = window == null ? StatisticsWindow.ALL_TIME : window;
        Instant now = clock.instant();

        List<ReviewHistory> history = storeRetry.execute("loadUserHistory",
                () -> reviewHistoryDao.loadUserHistorySince(userId, effectiveWindow.startFrom(now)));
        if (history.isEmpty()) {
            log.debug("No review history for user {} in window {}", userId, effectiveWindow);
            return LearningStatistics.empty(userId, effectiveWindow);
        }

        Map<RepetitionAlgorithm, Long> algorithmDistribution = new EnumMap<>(RepetitionAlgorithm.class);
        Map<Difficulty, Long> difficultyDistribution = new EnumMap<>(Difficulty.class);
        Map<Integer, Long> reviewsByHour = new TreeMap<>();
        Map<String, Integer> intervalDays = storeRetry.execute("loadIntervalDays", () -> scheduleDao.loadIntervalDays(userId));
        long retained = 0;
        long matureReviews = 0;
        long matureRetained = 0;
        long totalTimeSeconds = 0;
        long timedCount = 0;
        double confidenceSum = 0;
        long confidenceCount = 0;

        for (ReviewHistory review : history) {
            algorithmDistribution.merge(review.algorithm(), 1L, Long::sum);
            difficultyDistribution.merge(review.difficulty(), 1L, Long::sum);
            reviewsByHour.merge(review.reviewedAt().atZone(ZoneOffset.UTC).getHour(), 1L, Long::sum);

            boolean mature = intervalDays.getOrDefault(review.itemId(), 0) > LearningStatistics.MATURE_INTERVAL_DAYS;
            if (mature) {
                matureReviews++;
            }
            if (review.difficulty().isRetained()) {
                retained++;
                if (mature) {
                    matureRetained++;
                }
            }
            if (review.timeTakenSeconds() != null) {
                totalTimeSeconds += review.timeTakenSeconds();
                timedCount++;
            }
            if (review.confidence() != null) {
                confidenceSum += review.confidence();
                confidenceCount++;
            }
        }

        List<LocalDate> reviewDates = storeRetry.execute("loadReviewDates", () -> reviewHistoryDao.loadReviewDates(userId));
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);

        Instant endOfToday = today.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        long dueToday = storeRetry.execute("countDueToday", () -> scheduleDao.countDueSchedules(userId, endOfToday));
        long dueThisWeek = storeRetry.execute("countDueThisWeek",
                () -> scheduleDao.countDueSchedules(userId, now.plus(7, ChronoUnit.DAYS)));

        long reviewedCount = history.size();
        long youngReviews = reviewedCount - matureReviews;
        return new LearningStatistics(
                userId,
                effectiveWindow,
                reviewedCount,
                (double) retained / reviewedCount,
                ratio(matureRetained, matureReviews),
                ratio(retained - matureRetained, youngReviews),
                algorithmDistribution,
                difficultyDistribution,
                currentStreak(reviewDates, today),
                bestStreak(reviewDates),
                totalTimeSeconds,
                timedCount == 0 ? 0 : (double) totalTimeSeconds / timedCount,
                confidenceCount == 0 ? 0 : confidenceSum / confidenceCount,
                (double) reviewedCount / windowDays(effectiveWindow, history, today),
                reviewsByHour,
                busiestHour(reviewsByHour),
                dueToday,
                dueThisWeek);
    }

    private static double ratio(long count, long total) {
        return total == 0 ? 0 : (double) count / total;
    }

    static Integer busiestHour(Map<Integer, Long> reviewsByHour) {
        Integer busiest = null;
        long most = 0;
        for (Map.Entry<Integer, Long> entry : new TreeMap<>(reviewsByHour).entrySet()) {
            if (entry.getValue() > most) {
                busiest = entry.getKey();
                most = entry.getValue();
            }
        }
        return busiest;
    }

    // Consecutive days ending today; a streak that stopped yesterday no longer counts
    static int currentStreak(List<LocalDate> reviewDates, LocalDate today) {
        List<LocalDate> dates = descending(reviewDates);
        if (dates.isEmpty() || !dates.get(0).equals(today)) {
            return 0;
        }

        int streak = 1;
        for (int index = 1; index < dates.size(); index++) {
            if (!dates.get(index).equals(dates.get(index - 1).minusDays(1))) {
                break;
            }
            streak++;
        }
        return streak;
    }

    static int bestStreak(List<LocalDate> reviewDates) {
        List<LocalDate> dates = descending(reviewDates);
        if (dates.isEmpty()) {
            return 0;
        }

        int best = 1;
        int run = 1;
        for (int index = 1; index < dates.size(); index++) {
            run = dates.get(index).equals(dates.get(index - 1).minusDays(1)) ? run + 1 : 1;
            best = Math.max(best, run);
        }
        return best;
    }

    private static List<LocalDate> descending(List<LocalDate> reviewDates) {
        List<LocalDate> dates = new ArrayList<>(reviewDates.stream().distinct().toList());
        dates.sort((first, second) -> second.compareTo(first));
        return dates;
    }

    private static long windowDays(StatisticsWindow window, List<ReviewHistory> history, LocalDate today) {
        return switch (window) {
            case TODAY -> 1;
            case WEEK -> 7;
            case MONTH -> 30;
            case ALL_TIME -> {
                Instant firstReview = history.stream().map(ReviewHistory::reviewedAt).min(Instant::compareTo).orElse(today.atStartOfDay(ZoneOffset.UTC).toInstant());
                LocalDate first = LocalDate.ofInstant(firstReview, ZoneOffset.UTC);
                yield Math.max(1, ChronoUnit.DAYS.between(first, today) + 1);
            }
        };
    }
}
