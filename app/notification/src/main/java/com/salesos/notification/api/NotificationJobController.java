/*
 * Where: Notification API
 * What: Enqueue and status endpoints for notification jobs
 * Why: Lets domain services outside this process hand work to the engine
 */
package com.salesos.notification.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesos.notification.api.request.EnqueueNotificationRequest;
import com.salesos.notification.api.response.EnqueueNotificationResponse;
import com.salesos.notification.api.response.NotificationJobResponse;
import com.salesos.notification.model.NotificationJob;
import com.salesos.notification.service.EnqueueOptions;
import com.salesos.notification.service.NotificationEnqueueService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
public class NotificationJobController {

  private final NotificationEnqueueService enqueueService;
  private final ObjectMapper objectMapper;

  @PostMapping
  public ResponseEntity<EnqueueNotificationResponse> enqueue(
      @Valid @RequestBody EnqueueNotificationRequest request) {
    final EnqueueOptions options =
        EnqueueOptions.builder()
            .type(request.type())
            .priority(request.priority())
            .action(request.action())
            .actionData(request.actionData())
            .scheduledFor(request.scheduledFor())
            .build();
    final NotificationJob job =
        enqueueService.enqueue(request.userId(), request.title(), request.body(), options);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new EnqueueNotificationResponse(job.jobId(), job.status(), job.scheduledFor()));
  }

  @GetMapping("/{notificationId}")
  public ResponseEntity<NotificationJobResponse> get(
      @PathVariable("notificationId") UUID notificationId) {
    final NotificationJob job = enqueueService.get(notificationId);
    return ResponseEntity.ok(
        new NotificationJobResponse(
            job.jobId(),
            job.userId(),
            job.type(),
            job.priority(),
            job.title(),
            job.body(),
            job.action(),
            NotificationJsonSupport.readActionData(objectMapper, job.actionDataJson()),
            job.status(),
            job.scheduledFor(),
            job.createdAt(),
            job.sentAt(),
            job.deliveredAt(),
            job.lastError()));
  }
}
