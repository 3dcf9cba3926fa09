/*
 * Where: Notification service layer
 * What: Claims due task reminders and delivers them as TASK_REMINDER jobs
 * Why: The flag flip and the job insert commit together, so a reminder is either owned or untouched
 */
package com.salesos.notification.service;

import com.salesos.common.TraceIds;
import com.salesos.notification.config.NotificationReminderProperties;
import com.salesos.notification.model.JobStatus;
import com.salesos.notification.model.NotificationJob;
import com.salesos.notification.model.TaskReminder;
import com.salesos.notification.repository.NotificationJobRepository;
import com.salesos.notification.repository.TaskReminderRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;

import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class TaskReminderService {

    private static final Logger logger = LoggerFactory.getLogger(TaskReminderService.class);

    static final String REMINDER_TYPE = "TASK_REMINDER";
    static final String REMINDER_TITLE = "Task Reminder";
    static final String REMINDER_ACTION = "view_task";
    static final String CLAIM_SOURCE = "task_reminder";

    private final TaskReminderRepository reminderRepository;
    private final NotificationJobRepository jobRepository;
    private final NotificationDeliveryService deliveryService;
    private final NotificationMetrics metrics;
    private final NotificationReminderProperties properties;
    private final WorkerIdentity workerIdentity;
    private final ObjectMapper objectMapper;
    private final PlatformTransactionManager transactionManager;
    private final Clock clock;

    /**
     * Claims up to one batch of due reminders and delivers each one.
     *
     * @return number of reminders delivered (any terminal status)
     * @throws DataAccessException when the claim transaction fails; it rolls back as a whole
     */
    public int processDueReminders() {
        MDC.put(NotificationClaimService.MDC_CYCLE_ID, TraceIds.newCycleId());
        try {
            String workerId = workerIdentity.id();
            Instant now = Instant.now(clock);
            TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
            List<NotificationJob> jobs = transactionTemplate.execute(status -> claimAsJobs(now, workerId));
            if (jobs == null || jobs.isEmpty()) {
                return 0;
            }
            metrics.recordClaimed(CLAIM_SOURCE, jobs.size());
            logger.info("task reminders claimed count={} workerId={}", jobs.size(), workerId);
            int processed = 0;
            for (NotificationJob job : jobs) {
                try {
                    deliveryService.deliver(job, workerId);
                    processed++;
                } catch (DataAccessException ex) {
                    logger.error("task reminder storage failure jobId={}", job.jobId(), ex);
                }
            }
            return processed;
        } finally {
            MDC.remove(NotificationClaimService.MDC_CYCLE_ID);
        }
    }

    private List<NotificationJob> claimAsJobs(Instant now, String workerId) {
        List<TaskReminder> reminders = reminderRepository.claimDueReminders(properties.batchSize(), now);
        List<NotificationJob> jobs = new ArrayList<>(reminders.size());
        for (TaskReminder reminder : reminders) {
            NotificationJob job = toJob(reminder, now, workerId);
            jobRepository.insert(job);
            jobs.add(job);
        }
        return jobs;
    }

    @VisibleForTesting
    NotificationJob toJob(TaskReminder reminder, Instant now, String workerId) {
        return new NotificationJob(
                UUID.randomUUID(),
                reminder.ownerId(),
                REMINDER_TITLE,
                reminder.subject() + " is due",
                REMINDER_TYPE,
                reminder.notificationPriority(),
                REMINDER_ACTION,
                actionData(reminder),
                JobStatus.IN_FLIGHT,
                now,
                workerId,
                now,
                now.plus(properties.lease()),
                null,
                now,
                null,
                null);
    }

    private String actionData(TaskReminder reminder) {
        try {
            return objectMapper.writeValueAsString(Map.of("taskId", reminder.taskId().toString()));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("task reminder action data serialization failure", ex);
        }
    }
}
