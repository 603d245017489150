package io.github.orbit.runtime.execution;

import com.mongodb.client.result.UpdateResult;
import io.github.orbit.persistence.document.ScanDocument;
import io.github.orbit.persistence.document.ScheduledScanDocument;
import io.github.orbit.persistence.repository.ScanRepository;
import io.github.orbit.persistence.repository.ScheduledScanRepository;
import io.github.orbit.protocol.api.ScanStatus;
import io.github.orbit.runtime.provisioning.ProvisioningClient;
import io.github.orbit.runtime.provisioning.ProvisioningException;
import io.github.orbit.runtime.provisioning.ScanWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives a scan through {@code DEPLOYING -> RUNNING | FAILED} when one of its schedules fires.
 *
 * <p>Every failure ends in a log line and, at most, a {@link ScanStatus#FAILED} status;
 * nothing is thrown back at the dispatcher. Writes are best effort: when a save fails the
 * firing stops there and earlier writes stay as they are. Status writes touch only
 * {@code status} and {@code startTime}, so VM timestamps recorded by provisioning while the
 * playbook runs are kept.
 *
 * <p>A schedule whose previous firing is still provisioning is not started again; the
 * overlapping firing is dropped.
 */
@Service
public class ScheduledScanExecutor {

    private static final Logger log = LoggerFactory.getLogger(ScheduledScanExecutor.class);

    private final ScheduledScanRepository scheduledScanRepository;
    private final ScanRepository scanRepository;
    private final MongoTemplate mongoTemplate;
    private final ProvisioningClient provisioningClient;
    private final ScanWorkspace workspace;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ScheduledScanExecutor(ScheduledScanRepository scheduledScanRepository,
                                 ScanRepository scanRepository,
                                 MongoTemplate mongoTemplate,
                                 ProvisioningClient provisioningClient,
                                 ScanWorkspace workspace) {
        this.scheduledScanRepository = scheduledScanRepository;
        this.scanRepository = scanRepository;
        this.mongoTemplate = mongoTemplate;
        this.provisioningClient = provisioningClient;
        this.workspace = workspace;
    }

    public void onFire(String scheduleId, String scanId) {
        if (!inFlight.add(scheduleId)) {
            log.warn("Schedule {} is still deploying scan {} from a previous firing; skipping", scheduleId, scanId);
            return;
        }
        try {
            fire(scheduleId, scanId);
        } catch (RuntimeException e) {
            log.error("Unexpected error firing schedule {} for scan {}", scheduleId, scanId, e);
        } finally {
            inFlight.remove(scheduleId);
        }
    }

    public boolean isInFlight(String scheduleId) {
        return inFlight.contains(scheduleId);
    }

    private void fire(String scheduleId, String scanId) {
        log.info("Schedule {} fired for scan {}", scheduleId, scanId);

        Optional<ScheduledScanDocument> schedule = scheduledScanRepository.findById(scheduleId);
        if (schedule.isEmpty()) {
            log.warn("Schedule {} no longer exists; nothing to do", scheduleId);
            return;
        }

        Instant now = Instant.now();
        if (schedule.get().isExpired(now)) {
            log.info("Schedule {} expired at {}; not deploying", scheduleId, schedule.get().getEndDate());
            return;
        }
        if (schedule.get().getStartDate() != null && now.isBefore(schedule.get().getStartDate())) {
            log.info("Schedule {} starts at {}; not deploying yet", scheduleId, schedule.get().getStartDate());
            return;
        }

        if (scanRepository.findById(scanId).isEmpty()) {
            log.warn("Scan {} referenced by schedule {} not found", scanId, scheduleId);
            return;
        }

        Update deploying = new Update().set("status", ScanStatus.DEPLOYING).set("startTime", now);
        if (!updateScan(scanId, deploying, ScanStatus.DEPLOYING)) return;

        try {
            provisioningClient.execute(workspace.deployRequest(scanId));
        } catch (ProvisioningException e) {
            log.error("Provisioning failed for scan {} (schedule {}): {}", scanId, scheduleId, e.getMessage(), e);
            updateScan(scanId, new Update().set("status", ScanStatus.FAILED), ScanStatus.FAILED);
            return;
        }

        if (updateScan(scanId, new Update().set("status", ScanStatus.RUNNING), ScanStatus.RUNNING)) {
            log.info("Scan {} is running (schedule {})", scanId, scheduleId);
        }
    }

    // Update specific fields without replacing the scan document
    private boolean updateScan(String scanId, Update update, ScanStatus transition) {
        try {
            Query query = Query.query(Criteria.where("_id").is(scanId));
            UpdateResult result = mongoTemplate.updateFirst(query, update, ScanDocument.class);
            if (result.getMatchedCount() == 0) {
                log.warn("Scan {} disappeared before {} could be recorded", scanId, transition);
                return false;
            }
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to record {} for scan {}: {}", transition, scanId, e.getMessage(), e);
            return false;
        }
    }
}
