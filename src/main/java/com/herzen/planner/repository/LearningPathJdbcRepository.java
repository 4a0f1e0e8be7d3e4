package com.herzen.planner.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class LearningPathJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public LearningPathJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void savePlanLog(PlanLogRow row) {
        jdbcTemplate.update(
                "INSERT INTO learning_path_log(path_id, learner_id, primary_context, learning_style, objective_count, total_minutes, eligible_fallbacks, ts) VALUES (?,?,?,?,?,?,?,?)",
                row.pathId(), row.learnerId(), row.primaryContext(), row.learningStyle(),
                row.objectiveCount(), row.totalMinutes(), row.eligibleFallbacks(), row.ts().toString());
    }

    public List<PlanLogRow> loadPlanLog(String learnerId, int limit) {
        return jdbcTemplate.query(
                "SELECT path_id, learner_id, primary_context, learning_style, objective_count, total_minutes, eligible_fallbacks, ts FROM learning_path_log WHERE learner_id=? ORDER BY id DESC LIMIT ?",
                (rs, n) -> new PlanLogRow(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        rs.getInt(5), rs.getInt(6), rs.getString(7), Instant.parse(rs.getString(8))),
                learnerId, limit);
    }

    public long planCount(String learnerId) {
        Long value = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM learning_path_log WHERE learner_id=?",
                Long.class,
                learnerId);
        return value == null ? 0 : value;
    }

    public record PlanLogRow(String pathId,
                             String learnerId,
                             String primaryContext,
                             String learningStyle,
                             int objectiveCount,
                             int totalMinutes,
                             String eligibleFallbacks,
                             Instant ts) {}
}
