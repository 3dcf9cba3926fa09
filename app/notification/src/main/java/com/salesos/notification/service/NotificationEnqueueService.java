/*
 * Where: Notification service layer
 * What: Creates PENDING notification jobs and looks them up for the API
 * Why: Domain services hand work to the engine only through this contract
 */
package com.salesos.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesos.notification.model.JobStatus;
import com.salesos.notification.model.NotificationJob;
import com.salesos.notification.repository.NotificationJobRepository;

import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationEnqueueService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationEnqueueService.class);

    private final NotificationJobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Stores a PENDING job. Without a scheduled time the job is due immediately and is picked up by
     * the next claim cycle.
     */
    public NotificationJob enqueue(String userId, String title, String body, EnqueueOptions options) {
        requireText(userId, "userId");
        requireText(title, "title");
        requireText(body, "body");
        EnqueueOptions resolved = options == null ? EnqueueOptions.defaults() : options;
        Instant now = Instant.now(clock);
        NotificationJob job = new NotificationJob(
                UUID.randomUUID(),
                userId,
                title,
                body,
                resolved.type(),
                resolved.priority(),
                resolved.action(),
                serialize(resolved),
                JobStatus.PENDING,
                resolved.scheduledFor() == null ? now : resolved.scheduledFor(),
                null,
                null,
                null,
                null,
                now,
                null,
                null);
        jobRepository.insert(job);
        logger.info("notification enqueued jobId={} userId={} type={} scheduledFor={}",
                job.jobId(),
                userId,
                job.type(),
                job.scheduledFor());
        return job;
    }

    public NotificationJob get(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new NotificationJobNotFoundException(jobId));
    }

    public List<NotificationJob> listForUser(String userId) {
        return jobRepository.findByUserId(userId);
    }

    private String serialize(EnqueueOptions options) {
        try {
            return objectMapper.writeValueAsString(options.actionData());
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("actionData is not serializable", ex);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
