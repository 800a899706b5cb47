package com.gt.recall.session;

import com.gt.recall.model.ReviewSession;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ReviewSessionDao {

    void createSession(ReviewSession session);

    Optional<ReviewSession> loadSession(String sessionId);

    // Persists status, end time and statistics. Reviewed items are written by appendSessionItem.
    void saveSession(ReviewSession session);

    // Appending a position that is already stored leaves the existing row in place
    void appendSessionItem(String sessionId, int position, String itemId);

    List<String> loadActiveSessionIdsStartedBefore(Instant cutoff);
}
