package com.gt.flashcards.lifecycle.impl;

import com.gt.flashcards.lifecycle.ReviewLogDao;
import com.gt.flashcards.lifecycle.model.ReviewStats;
import com.gt.flashcards.model.Rating;
import com.gt.flashcards.model.ReviewLog;
import com.gt.flashcards.model.ReviewType;
import com.gt.flashcards.util.IdUtil;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ReviewLogDaoPG implements ReviewLogDao {

    private static final String CREATE_REVIEW_LOG_SQL =
            "INSERT INTO review_logs (id, card_id, reviewed_at, rating, interval_before, interval_after, stability_before, stability_after, " +
            "                         difficulty_before, difficulty_after, time_spent_ms, review_type) " +
            "VALUES (:id, :cardId, :reviewedAt, :rating, :intervalBefore, :intervalAfter, :stabilityBefore, :stabilityAfter, " +
            "        :difficultyBefore, :difficultyAfter, :timeSpentMs, :reviewType)";

    private static final String DELETE_REVIEW_LOG_SQL =
            "DELETE FROM review_logs WHERE id = :reviewLogId";

    private static final String LOAD_LATEST_REVIEW_LOG_SQL =
            "SELECT id, card_id, reviewed_at, rating, interval_before, interval_after, stability_before, stability_after, " +
            "       difficulty_before, difficulty_after, time_spent_ms, review_type " +
            "FROM review_logs " +
            "WHERE card_id = :cardId " +
            "ORDER BY reviewed_at DESC " +
            "LIMIT 1";

    private static final String LOAD_REVIEW_STATS_SQL =
            "SELECT MIN(reviewed_at) AS first_review_at, ROUND(AVG(time_spent_ms)) AS average_time_ms, COUNT(*) AS total_reviews " +
            "FROM review_logs " +
            "WHERE card_id = :cardId";

    private final NamedParameterJdbcTemplate template;

    public ReviewLogDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public void createReviewLog(ReviewLog reviewLog) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", IdUtil.toUuid(reviewLog.id()));
        params.addValue("cardId", IdUtil.toUuid(reviewLog.cardId()));
        params.addValue("reviewedAt", Timestamp.from(reviewLog.reviewedAt()));
        params.addValue("rating", reviewLog.rating().getDbValue());
        params.addValue("intervalBefore", reviewLog.intervalBefore());
        params.addValue("intervalAfter", reviewLog.intervalAfter());
        params.addValue("stabilityBefore", reviewLog.stabilityBefore());
        params.addValue("stabilityAfter", reviewLog.stabilityAfter());
        params.addValue("difficultyBefore", reviewLog.difficultyBefore());
        params.addValue("difficultyAfter", reviewLog.difficultyAfter());
        params.addValue("timeSpentMs", reviewLog.timeSpentMs());
        params.addValue("reviewType", reviewLog.reviewType().getDbValue());

        template.update(CREATE_REVIEW_LOG_SQL, params);
    }

    @Override
    public int deleteReviewLog(String reviewLogId) {
        return template.update(DELETE_REVIEW_LOG_SQL, Map.of("reviewLogId", IdUtil.toUuid(reviewLogId)));
    }

    @Override
    public Optional<ReviewLog> loadLatestReviewLog(String cardId) {
        List<ReviewLog> reviewLogs = template.query(LOAD_LATEST_REVIEW_LOG_SQL, Map.of("cardId", IdUtil.toUuid(cardId)), ReviewLogDaoPG::getReviewLogFromResultSet);

        return reviewLogs.isEmpty() ? Optional.empty() : Optional.of(reviewLogs.get(0));
    }

    @Override
    public ReviewStats loadReviewStats(String cardId) {
        return template.queryForObject(LOAD_REVIEW_STATS_SQL, Map.of("cardId", IdUtil.toUuid(cardId)), (rs, rowNum) -> {
            int totalReviews = rs.getInt("total_reviews");
            if (totalReviews == 0) {
                return ReviewStats.NO_REVIEWS;
            }

            return new ReviewStats(rs.getTimestamp("first_review_at").toInstant(), rs.getLong("average_time_ms"), totalReviews);
        });
    }

    private static ReviewLog getReviewLogFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new ReviewLog(
                rs.getString("id"),
                rs.getString("card_id"),
                Rating.fromValue(rs.getString("rating")),
                rs.getInt("interval_before"),
                rs.getInt("interval_after"),
                rs.getDouble("stability_before"),
                rs.getDouble("stability_after"),
                rs.getDouble("difficulty_before"),
                rs.getDouble("difficulty_after"),
                rs.getLong("time_spent_ms"),
                ReviewType.fromDbValue(rs.getString("review_type")),
                rs.getTimestamp("reviewed_at").toInstant());
    }
}
