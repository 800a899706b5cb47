package com.gt.recall.history.impl;

import com.gt.recall.exception.DaoException;
import com.gt.recall.history.ReviewHistoryDao;
import com.gt.recall.model.Difficulty;
import com.gt.recall.model.RepetitionAlgorithm;
import com.gt.recall.model.ReviewHistory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public class ReviewHistoryDaoPG implements ReviewHistoryDao {

    private static final String APPEND_HISTORY_SQL =
            "INSERT INTO review_history " +
                    "(item_id, user_id, session_id, algorithm, difficulty, time_taken_seconds, confidence, reviewed_at) " +
                    "VALUES (:itemId, :userId, :sessionId, :algorithm, :difficulty, :timeTakenSeconds, :confidence, :reviewedAt)";

    private static final String HISTORY_COLUMNS =
            "item_id, user_id, session_id, algorithm, difficulty, time_taken_seconds, confidence, reviewed_at ";

    private static final String LOAD_ITEM_HISTORY_SQL =
            "SELECT " + HISTORY_COLUMNS +
            "FROM review_history " +
            "WHERE item_id = :itemId AND user_id = :userId " +
            "ORDER BY reviewed_at, id";

    private static final String LOAD_USER_HISTORY_SINCE_SQL =
            "SELECT " + HISTORY_COLUMNS +
            "FROM review_history " +
            "WHERE user_id = :userId AND reviewed_at >= :since " +
            "ORDER BY reviewed_at, id";

    private static final String LOAD_REVIEW_DATES_SQL =
            "SELECT DISTINCT CAST(reviewed_at AT TIME ZONE 'UTC' AS DATE) AS review_date " +
            "FROM review_history " +
            "WHERE user_id = :userId " +
            "ORDER BY review_date DESC";

    private final NamedParameterJdbcTemplate template;

    public ReviewHistoryDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public void appendHistory(ReviewHistory history) {
        template.update(APPEND_HISTORY_SQL, new MapSqlParameterSource()
                .addValue("itemId", history.itemId())
                .addValue("userId", history.userId())
                .addValue("sessionId", history.sessionId())
                .addValue("algorithm", history.algorithm().toString())
                .addValue("difficulty", history.difficulty().toString())
                .addValue("timeTakenSeconds", history.timeTakenSeconds())
                .addValue("confidence", history.confidence())
                .addValue("reviewedAt", Timestamp.from(history.reviewedAt())));
    }

    @Override
    public List<ReviewHistory> loadItemHistory(String itemId, String userId) {
        return template.query(LOAD_ITEM_HISTORY_SQL, Map.of("itemId", itemId, "userId", userId),
                ReviewHistoryDaoPG::getHistoryFromResultSet);
    }

    @Override
    public List<ReviewHistory> loadUserHistorySince(String userId, Instant since) {
        return template.query(LOAD_USER_HISTORY_SINCE_SQL, Map.of("userId", userId, "since", Timestamp.from(since)),
                ReviewHistoryDaoPG::getHistoryFromResultSet);
    }

    @Override
    public List<LocalDate> loadReviewDates(String userId) {
        return template.query(LOAD_REVIEW_DATES_SQL, Map.of("userId", userId),
                (rs, rowNum) -> rs.getDate("review_date").toLocalDate());
    }

    private static ReviewHistory getHistoryFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        try {
            return new ReviewHistory(
                    rs.getString("item_id"),
                    rs.getString("user_id"),
                    rs.getString("session_id"),
                    RepetitionAlgorithm.valueOf(rs.getString("algorithm")),
                    Difficulty.valueOf(rs.getString("difficulty")),
                    rs.getObject("time_taken_seconds", Integer.class),
                    rs.getObject("confidence", Double.class),
                    toInstant(rs.getTimestamp("reviewed_at")));
        } catch (IllegalArgumentException ex) {
            throw new DaoException("Unable to map review history for item " + rs.getString("item_id"), ex);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
