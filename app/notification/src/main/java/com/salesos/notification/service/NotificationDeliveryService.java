/*
 * Where: Notification service layer
 * What: Delivers one claimed job (realtime first, then APNs fan-out) and writes its terminal status
 * Why: Every claimed job must leave IN_FLIGHT in the same pass, whatever the channels answer
 */
package com.salesos.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.salesos.notification.apns.ApnsConfigurationException;
import com.salesos.notification.config.NotificationClaimProperties;
import com.salesos.notification.model.DeviceRegistration;
import com.salesos.notification.model.JobStatus;
import com.salesos.notification.model.NotificationJob;
import com.salesos.notification.repository.NotificationJobRepository;

import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDeliveryService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryService.class);

    static final String MDC_JOB_ID = "job_id";
    static final String MDC_USER_ID = "user_id";
    static final String MDC_WORKER_ID = "worker_id";
    static final String NO_REACHABLE_CHANNEL = "no reachable channel";
    static final String CLAIM_LOST = "claim lost during fan-out";

    private final NotificationJobRepository jobRepository;
    private final RealtimeChannel realtimeChannel;
    private final NativePushChannel nativePushChannel;
    private final DeviceRegistry deviceRegistry;
    private final NotificationMessageMapper messageMapper;
    private final NotificationMetrics metrics;
    private final NotificationClaimProperties properties;
    private final Clock clock;

    /**
     * Runs one delivery pass over a job this worker has claimed and records the terminal status.
     * Channel and configuration errors end up on the job as FAILED; only the terminal write itself
     * can throw.
     *
     * @return the outcome that was written, or attempted to be written when the claim was lost
     */
    public DeliveryOutcome deliver(NotificationJob job, String workerId) {
        MDC.put(MDC_JOB_ID, job.jobId().toString());
        MDC.put(MDC_USER_ID, job.userId());
        MDC.put(MDC_WORKER_ID, workerId);
        try {
            DeliveryOutcome outcome;
            try {
                outcome = attempt(job, workerId);
            } catch (ApnsConfigurationException ex) {
                logger.error("native push is not configured jobId={}", job.jobId(), ex);
                outcome = DeliveryOutcome.failed("native push misconfigured: " + ex.getMessage());
            } catch (RuntimeException ex) {
                logger.warn("notification delivery failed jobId={}", job.jobId(), ex);
                outcome = DeliveryOutcome.failed(describe(ex));
            }
            terminalize(job, outcome, workerId);
            return outcome;
        } finally {
            MDC.remove(MDC_JOB_ID);
            MDC.remove(MDC_USER_ID);
            MDC.remove(MDC_WORKER_ID);
        }
    }

    private DeliveryOutcome attempt(NotificationJob job, String workerId) {
        boolean delivered = pushRealtime(job);
        metrics.recordChannelAttempt(NotificationMetrics.CHANNEL_REALTIME, delivered);
        if (delivered) {
            return DeliveryOutcome.delivered();
        }
        List<DeviceRegistration> devices = deviceRegistry.listActiveNativeDevices(job.userId());
        if (devices.isEmpty()) {
            logger.info("notification has no reachable channel jobId={} userId={}", job.jobId(), job.userId());
            return DeliveryOutcome.failed(NO_REACHABLE_CHANNEL);
        }
        return fanOut(job, devices, workerId);
    }

    private boolean pushRealtime(NotificationJob job) {
        try {
            return realtimeChannel.pushToUser(job.userId(), messageMapper.toEnvelope(job));
        } catch (RuntimeException ex) {
            // the realtime gateway is best effort; native push still gets its turn
            logger.warn("realtime push failed jobId={} userId={}", job.jobId(), job.userId(), ex);
            return false;
        }
    }

    private DeliveryOutcome fanOut(NotificationJob job, List<DeviceRegistration> devices, String workerId) {
        PushMessage message = messageMapper.toPushMessage(job);
        Duration leaseLength = leaseLength(job);
        Instant leaseUntil = job.leaseUntil();
        int attempted = 0;
        int accepted = 0;
        int invalidated = 0;
        String lastError = null;
        for (DeviceRegistration device : devices) {
            if (leaseRunsShort(leaseUntil, leaseLength)) {
                Instant renewed = Instant.now(clock).plus(leaseLength);
                if (jobRepository.extendLease(job.jobId(), renewed, workerId) == 0) {
                    logger.warn("lease lost during fan-out jobId={} workerId={} remainingDevices={}",
                            job.jobId(),
                            workerId,
                            devices.size() - attempted);
                    lastError = CLAIM_LOST;
                    break;
                }
                leaseUntil = renewed;
            }
            attempted++;
            PushResult result = sendToDevice(job, device, message);
            metrics.recordChannelAttempt(NotificationMetrics.CHANNEL_APNS, result.success());
            if (result.success()) {
                accepted++;
                continue;
            }
            lastError = "deviceId=" + device.deviceId() + " " + result.describe();
            if (result.permanent() && invalidate(device)) {
                invalidated++;
            }
        }
        JobStatus status = accepted > 0 ? JobStatus.SENT : JobStatus.FAILED;
        return new DeliveryOutcome(status, lastError, attempted, accepted, invalidated);
    }

    private PushResult sendToDevice(NotificationJob job, DeviceRegistration device, PushMessage message) {
        try {
            return nativePushChannel.send(device.pushToken(), message);
        } catch (ApnsConfigurationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            // recorded against this device only; the remaining devices are still tried
            logger.warn("native push to device failed jobId={} deviceId={}", job.jobId(), device.deviceId(), ex);
            return PushResult.unreachable(describe(ex));
        }
    }

    // a renewal is due once less than half of the lease is left
    private boolean leaseRunsShort(Instant leaseUntil, Duration leaseLength) {
        if (leaseUntil == null) {
            return false;
        }
        return !Instant.now(clock).plus(leaseLength.dividedBy(2)).isBefore(leaseUntil);
    }

    private Duration leaseLength(NotificationJob job) {
        if (job.lockedAt() != null && job.leaseUntil() != null && job.leaseUntil().isAfter(job.lockedAt())) {
            return Duration.between(job.lockedAt(), job.leaseUntil());
        }
        return properties.lease();
    }

    private boolean invalidate(DeviceRegistration device) {
        try {
            boolean changed = deviceRegistry.invalidateAddress(device.deviceId());
            if (changed) {
                metrics.recordDeviceInvalidated();
            }
            return changed;
        } catch (DataAccessException ex) {
            // the token stays; the next rejection retries the invalidation
            logger.error("device invalidation failed deviceId={}", device.deviceId(), ex);
            return false;
        }
    }

    private void terminalize(NotificationJob job, DeliveryOutcome outcome, String workerId) {
        Instant terminalAt = Instant.now(clock);
        String lastError = truncateError(outcome.lastError());
        int updated = switch (outcome.status()) {
            case DELIVERED -> jobRepository.markDelivered(job.jobId(), terminalAt, workerId);
            case SENT -> jobRepository.markSent(job.jobId(), terminalAt, lastError, workerId);
            case FAILED -> jobRepository.markFailed(job.jobId(), lastError, workerId);
            default -> throw new IllegalStateException("not a terminal status: " + outcome.status());
        };
        if (updated == 0) {
            logger.warn("notification {} but claim was lost jobId={} workerId={}",
                    outcome.status(),
                    job.jobId(),
                    workerId);
            return;
        }
        metrics.recordDeliveryResult(outcome.status());
        metrics.recordDeliveryE2eDelay(job.createdAt(), terminalAt);
        logger.info("notification terminalized jobId={} status={} devices={} accepted={} invalidated={} lastError={}",
                job.jobId(),
                outcome.status(),
                outcome.devicesAttempted(),
                outcome.devicesAccepted(),
                outcome.devicesInvalidated(),
                lastError);
    }

    @VisibleForTesting
    String truncateError(String message) {
        if (message == null) {
            return null;
        }
        int maxLength = properties.errorMessageMaxLength();
        if (message.length() <= maxLength) {
            return message;
        }
        return message.substring(0, maxLength);
    }

    private static String describe(RuntimeException ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }
}
