/*
 * Where: Notification API
 * What: Internal endpoint that wakes a user's devices with a background push
 * Why: Services that changed a user's data ask the app to refresh without showing an alert
 */
package com.salesos.notification.api;

import com.salesos.notification.api.request.SilentRefreshRequest;
import com.salesos.notification.api.response.SilentRefreshResponse;
import com.salesos.notification.service.SilentPushService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications/users")
@RequiredArgsConstructor
public class SilentPushController {

  private final SilentPushService silentPushService;

  @PostMapping("/{userId}/silent-refresh")
  public ResponseEntity<SilentRefreshResponse> refresh(
      @PathVariable("userId") String userId,
      @RequestBody(required = false) SilentRefreshRequest request) {
    final Map<String, Object> data =
        request == null || request.data() == null ? Map.of() : request.data();
    final int accepted = silentPushService.refreshUser(userId, data);
    return ResponseEntity.ok(new SilentRefreshResponse(userId, accepted));
  }
}
