package io.github.orbit.runtime.schedule;

import io.github.orbit.persistence.document.ScheduledScanDocument;
import io.github.orbit.persistence.repository.ScheduledScanRepository;
import io.github.orbit.runtime.config.OrbitProperties;
import io.github.orbit.runtime.execution.ScheduledScanExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the live cron triggers for persisted scan schedules.
 *
 * <p>The dispatcher ({@code scanTriggerScheduler}) only does bookkeeping: each firing is
 * handed to {@code scanFiringExecutor}, so a playbook that blocks for minutes never delays
 * another schedule's firing. Handles live for the lifetime of the process and are rebuilt
 * from the {@code scheduled_scans} collection by {@link #start()}.
 */
@Service
public class ScanScheduleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScanScheduleRegistry.class);

    private final ScheduledScanRepository scheduledScanRepository;
    private final RecurrenceCompiler compiler;
    private final ScheduledScanExecutor executor;
    private final TaskScheduler taskScheduler;
    private final TaskExecutor firingExecutor;
    private final ZoneId zone;

    private final Map<String, ScheduledFuture<?>> handles = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ScanScheduleRegistry(ScheduledScanRepository scheduledScanRepository,
                                RecurrenceCompiler compiler,
                                ScheduledScanExecutor executor,
                                @Qualifier("scanTriggerScheduler") TaskScheduler taskScheduler,
                                @Qualifier("scanFiringExecutor") TaskExecutor firingExecutor,
                                OrbitProperties properties) {
        this.scheduledScanRepository = scheduledScanRepository;
        this.compiler = compiler;
        this.executor = executor;
        this.taskScheduler = taskScheduler;
        this.firingExecutor = firingExecutor;
        this.zone = ZoneId.of(properties.scheduler().zone());
    }

    /** Registers every persisted schedule and starts accepting firings. Calling it twice is a no-op. */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Scan scheduler already running");
            return;
        }
        loadAndRegisterAll();
        log.info("Scan scheduler started with {} active schedules", handles.size());
    }

    /**
     * Stops issuing firings. Firings already handed to the executor finish; any that have
     * not begun yet see the stopped flag and return.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) return;
        int cancelled = cancelAll();
        log.info("Scan scheduler stopped; cancelled {} triggers", cancelled);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Replaces the live trigger set with the persisted one. Existing triggers are
     * de-registered first, so a reload never double-registers.
     */
    public void loadAndRegisterAll() {
        cancelAll();

        List<ScheduledScanDocument> schedules;
        try {
            schedules = scheduledScanRepository.findAll();
        } catch (DataAccessException e) {
            log.error("Failed to load scheduled scans: {}", e.getMessage(), e);
            return;
        }

        int registered = 0;
        for (ScheduledScanDocument schedule : schedules) {
            if (register(schedule)) registered++;
        }
        log.info("Registered {} of {} scheduled scans", registered, schedules.size());
    }

    /**
     * Registers one schedule, replacing any live trigger it already has.
     *
     * @return false if the schedule is expired or its recurrence does not compile
     */
    public boolean register(ScheduledScanDocument schedule) {
        String scheduleId = schedule.getId();
        if (schedule.isExpired(Instant.now())) {
            log.info("Skipping expired schedule {} (ended {})", scheduleId, schedule.getEndDate());
            return false;
        }

        String cron;
        try {
            cron = compiler.resolve(schedule);
        } catch (RecurrenceCompileException e) {
            log.warn("Skipping schedule {}: {}", scheduleId, e.getMessage());
            return false;
        }

        CronTrigger trigger;
        try {
            trigger = new CronTrigger(cron, zone);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping schedule {}: invalid cron expression '{}': {}", scheduleId, cron, e.getMessage());
            return false;
        }

        String scanId = schedule.getScanId();
        ScheduledFuture<?> future = taskScheduler.schedule(() -> dispatch(scheduleId, scanId), trigger);
        if (future == null) {
            log.warn("Cron expression '{}' for schedule {} never fires", cron, scheduleId);
            return false;
        }

        ScheduledFuture<?> previous = handles.put(scheduleId, future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.info("Scheduled scan {} (schedule {}) with cron '{}' in {}", scanId, scheduleId, cron, zone);
        return true;
    }

    /** Cancels the live trigger of a schedule, if it has one. A firing already running finishes. */
    public boolean cancel(String scheduleId) {
        ScheduledFuture<?> future = handles.remove(scheduleId);
        if (future == null) return false;
        future.cancel(false);
        log.info("Cancelled trigger for schedule {}", scheduleId);
        return true;
    }

    public boolean isRegistered(String scheduleId) {
        return handles.containsKey(scheduleId);
    }

    public int activeCount() {
        return handles.size();
    }

    /** Next fire time for a cron expression in the scheduler's zone, if it ever fires. */
    public Optional<Instant> nextFireTime(String cron) {
        try {
            ZonedDateTime next = CronExpression.parse(cron).next(ZonedDateTime.now(zone));
            return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private void dispatch(String scheduleId, String scanId) {
        if (!running.get()) return;
        try {
            firingExecutor.execute(() -> {
                if (!running.get()) {
                    log.debug("Scheduler stopped before schedule {} started; dropping firing", scheduleId);
                    return;
                }
                executor.onFire(scheduleId, scanId);
            });
        } catch (TaskRejectedException e) {
            log.error("Firing executor rejected schedule {} for scan {}: {}", scheduleId, scanId, e.getMessage());
        }
    }

    private int cancelAll() {
        int count = 0;
        for (String scheduleId : List.copyOf(handles.keySet())) {
            ScheduledFuture<?> future = handles.remove(scheduleId);
            if (future != null) {
                future.cancel(false);
                count++;
            }
        }
        return count;
    }
}
