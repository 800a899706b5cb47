package com.gt.recall.session.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.recall.exception.DaoException;
import com.gt.recall.model.ReviewSession;
import com.gt.recall.model.SessionStatistics;
import com.gt.recall.model.SessionStatus;
import com.gt.recall.session.ReviewSessionDao;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ReviewSessionDaoPG implements ReviewSessionDao {

    private static final String CREATE_SESSION_SQL =
            "INSERT INTO review_session (session_id, user_id, status, started_at, ended_at, statistics_json) " +
            "VALUES (:sessionId, :userId, :status, :startedAt, :endedAt, :statisticsJson)";

    private static final String SAVE_SESSION_SQL =
            "UPDATE review_session " +
            "SET status = :status, ended_at = :endedAt, statistics_json = :statisticsJson " +
            "WHERE session_id = :sessionId";

    private static final String LOAD_SESSION_SQL =
            "SELECT session_id, user_id, status, started_at, ended_at, statistics_json " +
            "FROM review_session " +
            "WHERE session_id = :sessionId";

    private static final String LOAD_SESSION_ITEMS_SQL =
            "SELECT item_id FROM review_session_item " +
            "WHERE session_id = :sessionId " +
            "ORDER BY position";

    private static final String APPEND_SESSION_ITEM_SQL =
            "INSERT INTO review_session_item (session_id, position, item_id) " +
            "VALUES (:sessionId, :position, :itemId) " +
            "ON CONFLICT (session_id, position) DO NOTHING";

    private static final String LOAD_ACTIVE_SESSIONS_STARTED_BEFORE_SQL =
            "SELECT session_id FROM review_session " +
            "WHERE status = 'ACTIVE' AND started_at < :cutoff " +
            "ORDER BY started_at";

    private final NamedParameterJdbcTemplate template;
    private final ObjectMapper objectMapper;

    public ReviewSessionDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        this.template = namedParameterJdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void createSession(ReviewSession session) {
        template.update(CREATE_SESSION_SQL, toParams(session).addValue("userId", session.userId())
                .addValue("startedAt", Timestamp.from(session.startedAt())));
    }

    @Override
    public Optional<ReviewSession> loadSession(String sessionId) {
        Optional<ReviewSession> session = template.query(LOAD_SESSION_SQL, Map.of("sessionId", sessionId), this::getSessionFromResultSet)
                .stream()
                .findFirst();
        if (session.isEmpty()) {
            return session;
        }

        List<String> itemIds = template.queryForList(LOAD_SESSION_ITEMS_SQL, Map.of("sessionId", sessionId), String.class);
        ReviewSession loaded = session.get();

        return Optional.of(new ReviewSession(loaded.sessionId(), loaded.userId(), loaded.status(), loaded.startedAt(),
                loaded.endedAt(), itemIds, loaded.statistics()));
    }

    @Override
    public void saveSession(ReviewSession session) {
        template.update(SAVE_SESSION_SQL, toParams(session));
    }

    @Override
    public void appendSessionItem(String sessionId, int position, String itemId) {
        template.update(APPEND_SESSION_ITEM_SQL, Map.of("sessionId", sessionId, "position", position, "itemId", itemId));
    }

    @Override
    public List<String> loadActiveSessionIdsStartedBefore(Instant cutoff) {
        return template.queryForList(LOAD_ACTIVE_SESSIONS_STARTED_BEFORE_SQL, Map.of("cutoff", Timestamp.from(cutoff)), String.class);
    }

    private MapSqlParameterSource toParams(ReviewSession session) {
        return new MapSqlParameterSource()
                .addValue("sessionId", session.sessionId())
                .addValue("status", session.status().toString())
                .addValue("endedAt", session.endedAt() == null ? null : Timestamp.from(session.endedAt()))
                .addValue("statisticsJson", writeStatistics(session));
    }

    private String writeStatistics(ReviewSession session) {
        try {
            return objectMapper.writeValueAsString(session.statistics());
        } catch (JsonProcessingException ex) {
            throw new DaoException("Unable to serialize statistics for session " + session.sessionId(), ex);
        }
    }

    private ReviewSession getSessionFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        String sessionId = rs.getString("session_id");

        try {
            String statisticsJson = rs.getString("statistics_json");
            SessionStatistics statistics = statisticsJson == null
                    ? SessionStatistics.EMPTY
                    : objectMapper.readValue(statisticsJson, SessionStatistics.class);

            return new ReviewSession(
                    sessionId,
                    rs.getString("user_id"),
                    SessionStatus.valueOf(rs.getString("status")),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("ended_at")),
                    List.of(),
                    statistics);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new DaoException("Unable to map review session " + sessionId, ex);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
