package io.github.orbit.gateway.config;

import io.github.orbit.runtime.config.OrbitProperties;
import io.github.orbit.runtime.schedule.ScanScheduleRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the scan scheduler once the application is ready to serve and stops it on
 * shutdown, before the dispatcher pools are torn down.
 */
@Component
public class ScanSchedulerLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ScanSchedulerLifecycle.class);

    private final ScanScheduleRegistry registry;
    private final boolean enabled;

    public ScanSchedulerLifecycle(ScanScheduleRegistry registry, OrbitProperties properties) {
        this.registry = registry;
        this.enabled = properties.scheduler().enabled();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!enabled) {
            log.info("Scan scheduler disabled (orbit.scheduler.enabled=false)");
            return;
        }
        registry.start();
    }

    @PreDestroy
    public void shutdown() {
        registry.stop();
    }
}
