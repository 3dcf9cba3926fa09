/*
 * Where: Notification data access
 * What: JDBC view of user_devices backing the DeviceRegistry contract
 * Why: Fan-out needs the user's live tokens and permanent rejections must clear them
 */
package com.salesos.notification.repository;

import static com.salesos.common.JdbcTimestampUtils.toInstant;
import static com.salesos.common.JdbcTimestampUtils.toTimestamp;

import com.salesos.notification.model.DeviceRegistration;
import com.salesos.notification.model.DeviceType;
import com.salesos.notification.model.PushTokenType;
import com.salesos.notification.service.DeviceRegistry;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeviceRegistrationRepository implements DeviceRegistry {

  private static final Logger logger = LoggerFactory.getLogger(DeviceRegistrationRepository.class);

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  @Override
  public List<DeviceRegistration> listActiveNativeDevices(String userId) {
    final String sql =
        """
        SELECT device_id, user_id, device_type, push_token, push_token_type,
               push_enabled, is_active, push_token_updated_at
        FROM user_devices
        WHERE user_id = :userId
          AND is_active = TRUE
          AND push_enabled = TRUE
          AND push_token IS NOT NULL
          AND push_token_type = 'APNS'
        ORDER BY last_seen_at DESC NULLS LAST
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public boolean invalidateAddress(UUID deviceId) {
    final Instant now = Instant.now(clock);
    // the token IS NOT NULL guard makes a second invalidation a zero-row update
    final String sql =
        """
        UPDATE user_devices
        SET push_token = NULL,
            push_token_updated_at = :now,
            push_token_invalidated_at = :now
        WHERE device_id = :deviceId
          AND push_token IS NOT NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("deviceId", deviceId).addValue("now", toTimestamp(now));
    final boolean cleared = jdbcTemplate.update(sql, params) > 0;
    if (cleared) {
      logger.info("device push token invalidated deviceId={}", deviceId);
    }
    return cleared;
  }

  private DeviceRegistration mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String tokenType = rs.getString("push_token_type");
    return new DeviceRegistration(
        rs.getObject("device_id", UUID.class),
        rs.getString("user_id"),
        DeviceType.valueOf(rs.getString("device_type")),
        rs.getString("push_token"),
        tokenType == null ? null : PushTokenType.valueOf(tokenType),
        rs.getBoolean("push_enabled"),
        rs.getBoolean("is_active"),
        toInstant(rs.getTimestamp("push_token_updated_at")));
  }
}
