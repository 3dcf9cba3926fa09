/*
 * Where: Notification data access
 * What: Claims due task reminders by flipping tasks.reminder_sent in one statement
 * Why: The flag is the reminder's claim; two workers must never both win the same task
 */
package com.salesos.notification.repository;

import static com.salesos.common.JdbcTimestampUtils.toInstant;
import static com.salesos.common.JdbcTimestampUtils.toTimestamp;

import com.salesos.notification.model.TaskReminder;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import lombok.RequiredArgsConstructor;

@Repository
@RequiredArgsConstructor
public class TaskReminderRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public List<TaskReminder> claimDueReminders(int limit, Instant now) {
        // explicit reminder_at wins over the due date; finished tasks never remind
        String sql = """
                WITH cte AS (
                  SELECT task_id
                  FROM tasks
                  WHERE reminder_sent = FALSE
                    AND COALESCE(reminder_at, due_date) <= :now
                    AND status NOT IN ('COMPLETED', 'CANCELLED')
                  ORDER BY COALESCE(reminder_at, due_date)
                  LIMIT :limit
                  FOR UPDATE SKIP LOCKED
                )
                UPDATE tasks t
                SET reminder_sent = TRUE,
                    reminder_sent_at = :now
                FROM cte
                WHERE t.task_id = cte.task_id
                RETURNING t.task_id, t.owner_id, t.subject, t.status, t.priority, t.due_date, t.reminder_at
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("now", toTimestamp(now))
                .addValue("limit", limit);
        return jdbcTemplate.query(sql, params, (rs, rowNum) -> new TaskReminder(
                rs.getObject("task_id", UUID.class),
                rs.getString("owner_id"),
                rs.getString("subject"),
                rs.getString("status"),
                rs.getString("priority"),
                toInstant(rs.getTimestamp("due_date")),
                toInstant(rs.getTimestamp("reminder_at"))));
    }
}
