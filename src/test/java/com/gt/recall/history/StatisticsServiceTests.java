package com.gt.recall.history;

import com.gt.recall.model.Difficulty;
import com.gt.recall.model.LearningStatistics;
import com.gt.recall.model.RepetitionAlgorithm;
import com.gt.recall.model.ReviewHistory;
import com.gt.recall.model.StatisticsWindow;
import com.gt.recall.schedule.ScheduleDao;
import com.gt.recall.schedule.StoreRetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class StatisticsServiceTests {

    private static final Instant NOW = Instant.parse("2024-03-10T15:30:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 10);
    private static final String TEST_USER_ID = "testUser";

    @Mock private ReviewHistoryDao reviewHistoryDao;
    @Mock private ScheduleDao scheduleDao;

    private StatisticsService statisticsService;

    @BeforeEach
    public void setup() {
        statisticsService = new StatisticsService(reviewHistoryDao, scheduleDao, new StoreRetry(3, 1, 4), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void testEmptyHistory() {
        when(reviewHistoryDao.loadUserHistorySince(TEST_USER_ID, StatisticsWindow.WEEK.startFrom(NOW))).thenReturn(List.of());

        LearningStatistics statistics = statisticsService.getStatistics(TEST_USER_ID, StatisticsWindow.WEEK);

        assertEquals(LearningStatistics.empty(TEST_USER_ID, StatisticsWindow.WEEK), statistics);
        verify(scheduleDao, never()).countDueSchedules(any(), any());
    }

    @Test
    public void testGetStatistics() {
        when(reviewHistoryDao.loadUserHistorySince(TEST_USER_ID, StatisticsWindow.WEEK.startFrom(NOW))).thenReturn(List.of(
                history(RepetitionAlgorithm.SM2, Difficulty.GOOD, 10, 0.8, NOW.minus(Duration.ofDays(2))),
                history(RepetitionAlgorithm.SM2, Difficulty.AGAIN, 20, null, NOW.minus(Duration.ofDays(1))),
                history(RepetitionAlgorithm.ANKI, Difficulty.EASY, null, 0.6, NOW.minus(Duration.ofHours(1))),
                history(RepetitionAlgorithm.LEITNER, Difficulty.HARD, 30, 1.0, NOW)));
        when(reviewHistoryDao.loadReviewDates(TEST_USER_ID)).thenReturn(List.of(TODAY, TODAY.minusDays(1), TODAY.minusDays(2)));
        when(scheduleDao.countDueSchedules(TEST_USER_ID, Instant.parse("2024-03-11T00:00:00Z"))).thenReturn(4L);
        when(scheduleDao.countDueSchedules(TEST_USER_ID, NOW.plus(Duration.ofDays(7)))).thenReturn(9L);

        LearningStatistics statistics = statisticsService.getStatistics(TEST_USER_ID, StatisticsWindow.WEEK);

        assertEquals(4, statistics.reviewedCount());
        assertEquals(0.5, statistics.retentionRateAvg(), 1e-9);
        assertEquals(Map.of(RepetitionAlgorithm.SM2, 2L, RepetitionAlgorithm.ANKI, 1L, RepetitionAlgorithm.LEITNER, 1L),
                statistics.algorithmDistribution());
        assertEquals(Map.of(Difficulty.AGAIN, 1L, Difficulty.HARD, 1L, Difficulty.GOOD, 1L, Difficulty.EASY, 1L),
                statistics.difficultyDistribution());
        assertEquals(3, statistics.streakDays());
        assertEquals(3, statistics.bestStreakDays());
        assertEquals(60, statistics.totalTimeSeconds());
        assertEquals(20.0, statistics.averageTimeSeconds(), 1e-9);
        assertEquals(0.8, statistics.averageConfidence(), 1e-9);
        assertEquals(4.0 / 7, statistics.averageDailyReviews(), 1e-9);
        assertEquals(Map.of(14, 1L, 15, 3L), statistics.reviewsByHour());
        assertEquals(15, statistics.bestReviewHour());
        assertEquals(0.0, statistics.matureRetentionRate(), 1e-9);
        assertEquals(0.5, statistics.youngRetentionRate(), 1e-9);
        assertEquals(4, statistics.dueToday());
        assertEquals(9, statistics.dueThisWeek());
    }

    @Test
    public void testMatureAndYoungRetention() {
        when(reviewHistoryDao.loadUserHistorySince(TEST_USER_ID, StatisticsWindow.ALL_TIME.startFrom(NOW))).thenReturn(List.of(
                history("mature-1", Difficulty.GOOD, NOW.minus(Duration.ofDays(3))),
                history("mature-1", Difficulty.AGAIN, NOW.minus(Duration.ofDays(2))),
                history("mature-2", Difficulty.EASY, NOW.minus(Duration.ofDays(1))),
                history("young-1", Difficulty.HARD, NOW.minus(Duration.ofHours(2))),
                history("unscheduled", Difficulty.GOOD, NOW)));
        when(scheduleDao.loadIntervalDays(TEST_USER_ID)).thenReturn(Map.of("mature-1", 30, "mature-2", 22, "young-1", 21));
        when(reviewHistoryDao.loadReviewDates(TEST_USER_ID)).thenReturn(List.of(TODAY));

        LearningStatistics statistics = statisticsService.getStatistics(TEST_USER_ID, StatisticsWindow.ALL_TIME);

        assertEquals(5, statistics.reviewedCount());
        assertEquals(0.6, statistics.retentionRateAvg(), 1e-9);
        assertEquals(2.0 / 3, statistics.matureRetentionRate(), 1e-9);
        assertEquals(0.5, statistics.youngRetentionRate(), 1e-9);
    }

    @Test
    public void testBusiestHourPrefersEarliestOnTie() {
        assertEquals(9, StatisticsService.busiestHour(Map.of(21, 2L, 9, 2L, 14, 1L)));
        assertNull(StatisticsService.busiestHour(Map.of()));
    }

    @Test
    public void testCurrentStreakMustIncludeToday() {
        List<LocalDate> dates = List.of(TODAY.minusDays(1), TODAY.minusDays(2), TODAY.minusDays(3));

        assertEquals(0, StatisticsService.currentStreak(dates, TODAY));
        assertEquals(3, StatisticsService.bestStreak(dates));
    }

    @Test
    public void testBestStreakAcrossGaps() {
        List<LocalDate> dates = List.of(TODAY, TODAY.minusDays(3), TODAY.minusDays(4), TODAY.minusDays(5), TODAY.minusDays(6), TODAY.minusDays(9));

        assertEquals(1, StatisticsService.currentStreak(dates, TODAY));
        assertEquals(4, StatisticsService.bestStreak(dates));
        assertEquals(0, StatisticsService.bestStreak(List.of()));
    }

    private static ReviewHistory history(String itemId, Difficulty difficulty, Instant reviewedAt) {
        return new ReviewHistory(itemId, TEST_USER_ID, null, RepetitionAlgorithm.SM2, difficulty, null, null, reviewedAt);
    }

    private static ReviewHistory history(RepetitionAlgorithm algorithm, Difficulty difficulty, Integer timeTakenSeconds,
                                         Double confidence, Instant reviewedAt) {
        return new ReviewHistory("item", TEST_USER_ID, null, algorithm, difficulty, timeTakenSeconds, confidence, reviewedAt);
    }
}
