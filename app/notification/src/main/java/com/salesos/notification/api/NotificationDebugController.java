/*
 * Where: Notification debug API
 * What: Lists a user's notification jobs with their delivery state
 * Why: Development and manual verification
 */
package com.salesos.notification.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesos.notification.model.NotificationJob;
import com.salesos.notification.service.NotificationEnqueueService;

import lombok.RequiredArgsConstructor;

import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/notification")
@RequiredArgsConstructor
public class NotificationDebugController {

    private final NotificationEnqueueService enqueueService;
    private final ObjectMapper objectMapper;

    @GetMapping("/inbox/{userId}")
    public NotificationInboxResponse inbox(@PathVariable("userId") String userId) {
        List<NotificationSummary> items = enqueueService.listForUser(userId).stream()
                .map(this::toSummary)
                .toList();
        return new NotificationInboxResponse(userId, items);
    }

    private NotificationSummary toSummary(NotificationJob job) {
        return new NotificationSummary(
                job.jobId(),
                job.type(),
                job.title(),
                job.status(),
                job.createdAt(),
                job.sentAt(),
                job.deliveredAt(),
                job.lastError(),
                NotificationJsonSupport.readActionData(objectMapper, job.actionDataJson()));
    }
}
