/*
 * Where: Notification service layer
 * What: One claim cycle for scheduled notification jobs
 * Why: Claims are atomic and short; delivery IO runs outside any transaction
 */
package com.salesos.notification.service;

import com.salesos.common.TraceIds;
import com.salesos.notification.config.NotificationClaimProperties;
import com.salesos.notification.model.NotificationJob;
import com.salesos.notification.repository.NotificationJobRepository;

import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationClaimService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationClaimService.class);

    static final String MDC_CYCLE_ID = "cycle_id";
    static final String CLAIM_SOURCE = "notification";

    private final NotificationJobRepository jobRepository;
    private final NotificationDeliveryService deliveryService;
    private final NotificationMetrics metrics;
    private final NotificationClaimProperties properties;
    private final WorkerIdentity workerIdentity;
    private final Clock clock;

    /**
     * Claims up to one batch of due jobs and delivers each of them.
     *
     * @return number of jobs this cycle delivered (any terminal status)
     * @throws DataAccessException when the claim statement fails; nothing was claimed and the next
     *     cycle retries
     */
    public int processDueBatch() {
        MDC.put(MDC_CYCLE_ID, TraceIds.newCycleId());
        try {
            String workerId = workerIdentity.id();
            Instant now = Instant.now(clock);
            List<UUID> claimed = jobRepository.claimDueBatch(
                    properties.batchSize(),
                    now,
                    now.plus(properties.lease()),
                    workerId);
            metrics.recordClaimed(CLAIM_SOURCE, claimed.size());
            if (claimed.isEmpty()) {
                refreshBacklog();
                return 0;
            }
            logger.info("notification jobs claimed count={} workerId={}", claimed.size(), workerId);
            int processed = 0;
            for (UUID jobId : claimed) {
                if (processClaimed(jobId, workerId)) {
                    processed++;
                }
            }
            refreshBacklog();
            return processed;
        } finally {
            MDC.remove(MDC_CYCLE_ID);
        }
    }

    private boolean processClaimed(UUID jobId, String workerId) {
        try {
            Optional<NotificationJob> job = jobRepository.findById(jobId);
            if (job.isEmpty() || !job.get().isOwnedBy(workerId)) {
                logger.warn("claimed notification job is no longer owned jobId={} workerId={}", jobId, workerId);
                return false;
            }
            deliveryService.deliver(job.get(), workerId);
            return true;
        } catch (DataAccessException ex) {
            // the row stays IN_FLIGHT and is reclaimed once its lease passes
            logger.error("notification job storage failure jobId={}", jobId, ex);
            return false;
        }
    }

    private void refreshBacklog() {
        try {
            metrics.updateBacklogCurrent(jobRepository.countDue(Instant.now(clock)));
        } catch (DataAccessException ex) {
            logger.warn("notification backlog count failed", ex);
        }
    }
}
