package com.gt.recall.schedule.impl;

import com.gt.recall.exception.DaoException;
import com.gt.recall.exception.InvalidStateException;
import com.gt.recall.model.MemoryStrength;
import com.gt.recall.model.RepetitionAlgorithm;
import com.gt.recall.model.ReviewSchedule;
import com.gt.recall.model.ScheduleStatus;
import com.gt.recall.schedule.ScheduleDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class ScheduleDaoPG implements ScheduleDao {

    private static final Logger log = LoggerFactory.getLogger(ScheduleDaoPG.class);

    private static final String SCHEDULE_COLUMNS =
            "item_id, user_id, scheduled_date, algorithm, status, ease_factor, interval_days, repetitions, retention_rate, " +
            "stability, last_review, learning_step, leitner_box, lapse_streak, leech ";

    private static final String INSERT_SCHEDULE_SQL =
            "INSERT INTO review_schedule (" + SCHEDULE_COLUMNS + ", update_instant) " +
            "VALUES (:itemId, :userId, :scheduledDate, :algorithm, :status, :easeFactor, :intervalDays, :repetitions, :retentionRate, " +
                    ":stability, :lastReview, :learningStep, :leitnerBox, :lapseStreak, :leech, now()) ";

    private static final String SAVE_SCHEDULE_SQL =
            INSERT_SCHEDULE_SQL +
            "ON CONFLICT (item_id, user_id) DO UPDATE " +
                    "SET scheduled_date = :scheduledDate, algorithm = :algorithm, status = :status, ease_factor = :easeFactor, " +
                    "interval_days = :intervalDays, repetitions = :repetitions, retention_rate = :retentionRate, stability = :stability, " +
                    "last_review = :lastReview, learning_step = :learningStep, leitner_box = :leitnerBox, lapse_streak = :lapseStreak, " +
                    "leech = :leech, update_instant = now()";

    private static final String CREATE_SCHEDULE_IF_ABSENT_SQL =
            INSERT_SCHEDULE_SQL +
            "ON CONFLICT (item_id, user_id) DO NOTHING";

    private static final String LOAD_SCHEDULE_SQL =
            "SELECT " + SCHEDULE_COLUMNS +
            "FROM review_schedule " +
            "WHERE item_id = :itemId AND user_id = :userId";

    private static final String LOAD_SCHEDULE_FOR_UPDATE_SQL =
            LOAD_SCHEDULE_SQL + " FOR UPDATE";

    private static final String LOAD_DUE_SCHEDULES_SQL =
            "SELECT " + SCHEDULE_COLUMNS +
            "FROM review_schedule " +
            "WHERE user_id = :userId AND status = 'ACTIVE' AND scheduled_date <= :asOf";

    private static final String COUNT_DUE_SCHEDULES_SQL =
            "SELECT COUNT(*) FROM review_schedule " +
            "WHERE user_id = :userId AND status = 'ACTIVE' AND scheduled_date <= :cutoff";

    private static final String LOAD_INTERVAL_DAYS_SQL =
            "SELECT item_id, interval_days FROM review_schedule " +
            "WHERE user_id = :userId";

    private static final String ARCHIVE_ITEM_SQL =
            "UPDATE review_schedule " +
            "SET status = 'ARCHIVED', update_instant = now() " +
            "WHERE item_id = :itemId AND status <> 'ARCHIVED'";

    private final NamedParameterJdbcTemplate template;

    public ScheduleDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Optional<ReviewSchedule> loadSchedule(String itemId, String userId) {
        return template.query(LOAD_SCHEDULE_SQL, Map.of("itemId", itemId, "userId", userId),
                        ScheduleDaoPG::getScheduleFromResultSet)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<ReviewSchedule> loadScheduleForUpdate(String itemId, String userId) {
        return template.query(LOAD_SCHEDULE_FOR_UPDATE_SQL, Map.of("itemId", itemId, "userId", userId),
                        ScheduleDaoPG::getScheduleFromResultSet)
                .stream()
                .findFirst();
    }

    @Override
    public void saveSchedule(ReviewSchedule schedule) {
        template.update(SAVE_SCHEDULE_SQL, toParams(schedule));
    }

    @Override
    public boolean createScheduleIfAbsent(ReviewSchedule schedule) {
        return template.update(CREATE_SCHEDULE_IF_ABSENT_SQL, toParams(schedule)) > 0;
    }

    @Override
    public List<ReviewSchedule> loadDueSchedules(String userId, Instant asOf) {
        return template.query(LOAD_DUE_SCHEDULES_SQL, Map.of("userId", userId, "asOf", Timestamp.from(asOf)),
                ScheduleDaoPG::getScheduleFromResultSet);
    }

    @Override
    public long countDueSchedules(String userId, Instant cutoff) {
        Long count = template.queryForObject(COUNT_DUE_SCHEDULES_SQL,
                Map.of("userId", userId, "cutoff", Timestamp.from(cutoff)), Long.class);

        return count == null ? 0 : count;
    }

    @Override
    public Map<String, Integer> loadIntervalDays(String userId) {
        return template.query(LOAD_INTERVAL_DAYS_SQL, Map.of("userId", userId),
                        (rs, rowNum) -> Map.entry(rs.getString("item_id"), rs.getInt("interval_days")))
                .stream()
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    @Override
    public int archiveItem(String itemId) {
        int rowsUpdated = template.update(ARCHIVE_ITEM_SQL, Map.of("itemId", itemId));

        log.debug("Archived {} schedules for item {}", rowsUpdated, itemId);
        return rowsUpdated;
    }

    private static MapSqlParameterSource toParams(ReviewSchedule schedule) {
        MemoryStrength strength = schedule.strength();

        return new MapSqlParameterSource()
                .addValue("itemId", schedule.itemId())
                .addValue("userId", schedule.userId())
                .addValue("scheduledDate", Timestamp.from(schedule.scheduledDate()))
                .addValue("algorithm", schedule.algorithm().toString())
                .addValue("status", schedule.status().toString())
                .addValue("easeFactor", strength.easeFactor())
                .addValue("intervalDays", strength.intervalDays())
                .addValue("repetitions", strength.repetitions())
                .addValue("retentionRate", strength.retentionRate())
                .addValue("stability", strength.stability())
                .addValue("lastReview", strength.lastReview() == null ? null : Timestamp.from(strength.lastReview()))
                .addValue("learningStep", strength.learningStep())
                .addValue("leitnerBox", strength.leitnerBox())
                .addValue("lapseStreak", strength.lapseStreak())
                .addValue("leech", schedule.leech());
    }

    private static ReviewSchedule getScheduleFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        try {
            MemoryStrength strength = new MemoryStrength(
                    rs.getDouble("ease_factor"),
                    rs.getInt("interval_days"),
                    rs.getInt("repetitions"),
                    rs.getDouble("retention_rate"),
                    rs.getDouble("stability"),
                    toInstant(rs.getTimestamp("last_review")),
                    rs.getInt("learning_step"),
                    rs.getInt("leitner_box"),
                    rs.getInt("lapse_streak"));

            return new ReviewSchedule(
                    rs.getString("item_id"),
                    rs.getString("user_id"),
                    toInstant(rs.getTimestamp("scheduled_date")),
                    RepetitionAlgorithm.valueOf(rs.getString("algorithm")),
                    ScheduleStatus.valueOf(rs.getString("status")),
                    strength,
                    rs.getBoolean("leech"));
        } catch (IllegalArgumentException | InvalidStateException ex) {
            throw new DaoException("Unable to map review schedule for item " + rs.getString("item_id"), ex);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
