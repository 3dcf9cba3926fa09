/*
 * Where: Notification API request DTO
 * What: Body of POST /v1/notifications/users/{userId}/silent-refresh
 */
package com.salesos.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "request DTO is only read once when the push is built")
public record SilentRefreshRequest(Map<String, Object> data) {}
