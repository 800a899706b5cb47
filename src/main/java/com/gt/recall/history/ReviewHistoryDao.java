package com.gt.recall.history;

import com.gt.recall.model.ReviewHistory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public interface ReviewHistoryDao {

    void appendHistory(ReviewHistory history);

    List<ReviewHistory> loadItemHistory(String itemId, String userId);

    List<ReviewHistory> loadUserHistorySince(String userId, Instant since);

    // Distinct UTC calendar days on which the user reviewed anything, most recent first
    List<LocalDate> loadReviewDates(String userId);
}
