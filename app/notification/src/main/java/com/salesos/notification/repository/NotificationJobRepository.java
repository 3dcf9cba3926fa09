/*
 * Where: Notification data access
 * What: Inserts, claims, loads and terminalizes notification_jobs rows
 * Why: The claim statement is the only concurrency control between workers
 */
package com.salesos.notification.repository;

import static com.salesos.common.JdbcTimestampUtils.toInstant;
import static com.salesos.common.JdbcTimestampUtils.toTimestamp;

import com.salesos.notification.model.JobStatus;
import com.salesos.notification.model.NotificationJob;
import com.salesos.notification.model.NotificationPriority;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationJobRepository {

  private static final String COLUMNS =
      """
      job_id, user_id, title, body, type, priority, action, action_data::text AS action_data_text,
      status, scheduled_for, locked_by, locked_at, lease_until, last_error,
      created_at, sent_at, delivered_at
      """;

  private static final String EMPTY_JSON = "{}";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationJob job) {
    final String sql =
        """
        INSERT INTO notification_jobs (
          job_id, user_id, title, body, type, priority, action, action_data,
          status, scheduled_for, locked_by, locked_at, lease_until, last_error,
          created_at, sent_at, delivered_at
        ) VALUES (
          :jobId, :userId, :title, :body, :type, :priority, :action, CAST(:actionData AS jsonb),
          :status, :scheduledFor, :lockedBy, :lockedAt, :leaseUntil, :lastError,
          :createdAt, :sentAt, :deliveredAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", job.jobId())
            .addValue("userId", job.userId())
            .addValue("title", job.title())
            .addValue("body", job.body())
            .addValue("type", job.type())
            .addValue("priority", job.priority().name())
            .addValue("action", job.action())
            .addValue(
                "actionData", job.actionDataJson() == null ? EMPTY_JSON : job.actionDataJson())
            .addValue("status", job.status().name())
            .addValue("scheduledFor", toTimestamp(job.scheduledFor()))
            .addValue("lockedBy", job.lockedBy())
            .addValue("lockedAt", toTimestamp(job.lockedAt()))
            .addValue("leaseUntil", toTimestamp(job.leaseUntil()))
            .addValue("lastError", job.lastError())
            .addValue("createdAt", toTimestamp(job.createdAt()))
            .addValue("sentAt", toTimestamp(job.sentAt()))
            .addValue("deliveredAt", toTimestamp(job.deliveredAt()));
    jdbcTemplate.update(sql, params);
    return job.jobId();
  }

  public Optional<NotificationJob> findById(UUID jobId) {
    final String sql = "SELECT " + COLUMNS + " FROM notification_jobs WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationJob> findByUserId(String userId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM notification_jobs WHERE user_id = :userId ORDER BY created_at DESC";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * Atomically moves up to {@code limit} due jobs to IN_FLIGHT for {@code lockedBy} and returns
   * their ids. Rows locked by a concurrent claim are skipped, never waited on. IN_FLIGHT rows whose
   * lease has passed are eligible again (their worker died mid-delivery).
   */
  public List<UUID> claimDueBatch(int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT job_id
          FROM notification_jobs
          WHERE (
            status = 'PENDING'
            AND scheduled_for <= :now
          )
          OR (
            status = 'IN_FLIGHT'
            AND lease_until <= :now
          )
          ORDER BY scheduled_for
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notification_jobs j
        SET status = 'IN_FLIGHT',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM cte
        WHERE j.job_id = cte.job_id
        RETURNING j.job_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getObject("job_id", UUID.class));
  }

  /** Pushes lease_until forward while {@code lockedBy} still owns the IN_FLIGHT row. */
  public int extendLease(UUID jobId, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        UPDATE notification_jobs
        SET lease_until = :leaseUntil
        WHERE job_id = :jobId
          AND status = 'IN_FLIGHT'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markDelivered(UUID jobId, Instant deliveredAt, String lockedBy) {
    final String sql =
        """
        UPDATE notification_jobs
        SET status = 'DELIVERED',
            delivered_at = :terminalAt,
            last_error = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'IN_FLIGHT'
          AND locked_by = :lockedBy
        """;
    return jdbcTemplate.update(sql, terminalParams(jobId, deliveredAt, lockedBy));
  }

  public int markSent(UUID jobId, Instant sentAt, String lastError, String lockedBy) {
    // last_error keeps the failing device's reason when only part of the fan-out was accepted
    final String sql =
        """
        UPDATE notification_jobs
        SET status = 'SENT',
            sent_at = :terminalAt,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'IN_FLIGHT'
          AND locked_by = :lockedBy
        """;
    return jdbcTemplate.update(
        sql, terminalParams(jobId, sentAt, lockedBy).addValue("lastError", lastError));
  }

  public int markFailed(UUID jobId, String lastError, String lockedBy) {
    final String sql =
        """
        UPDATE notification_jobs
        SET status = 'FAILED',
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'IN_FLIGHT'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("lastError", lastError)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int countDue(Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_jobs
        WHERE status = 'PENDING'
          AND scheduled_for <= :now
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private MapSqlParameterSource terminalParams(UUID jobId, Instant terminalAt, String lockedBy) {
    return new MapSqlParameterSource()
        .addValue("jobId", jobId)
        .addValue("terminalAt", toTimestamp(terminalAt))
        .addValue("lockedBy", lockedBy);
  }

  private NotificationJob mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationJob(
        rs.getObject("job_id", UUID.class),
        rs.getString("user_id"),
        rs.getString("title"),
        rs.getString("body"),
        rs.getString("type"),
        NotificationPriority.valueOf(rs.getString("priority")),
        rs.getString("action"),
        rs.getString("action_data_text"),
        JobStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("scheduled_for")),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("lease_until")),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("sent_at")),
        toInstant(rs.getTimestamp("delivered_at")));
  }
}
