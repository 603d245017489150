package io.github.orbit.runtime.cost;

import io.github.orbit.persistence.document.ProviderDocument;
import io.github.orbit.persistence.document.ScanDocument;
import io.github.orbit.persistence.repository.ProviderRepository;
import io.github.orbit.persistence.repository.ScanRepository;
import io.github.orbit.protocol.api.ScanStatus;
import io.github.orbit.runtime.config.OrbitProperties;
import io.github.orbit.runtime.pricing.InvalidProviderSettingsException;
import io.github.orbit.runtime.pricing.PricingLookupException;
import io.github.orbit.runtime.pricing.ProviderSettings;
import io.github.orbit.runtime.pricing.VmPriceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Periodic batch pass that prices finished scans. Each tick picks a bounded batch of scans
 * whose VM lifetime is known but whose cost is still null, and bills the elapsed time in
 * whole hours rounded up. A record that cannot be priced stays null and is retried on the
 * next tick; nothing here stops subsequent records or ticks.
 */
@Service
public class ScanCostReconciler {

    private static final Logger log = LoggerFactory.getLogger(ScanCostReconciler.class);
    private static final long MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    private final ScanRepository scanRepository;
    private final ProviderRepository providerRepository;
    private final VmPriceService vmPriceService;
    private final int batchSize;

    public ScanCostReconciler(ScanRepository scanRepository,
                              ProviderRepository providerRepository,
                              VmPriceService vmPriceService,
                              OrbitProperties properties) {
        this.scanRepository = scanRepository;
        this.providerRepository = providerRepository;
        this.vmPriceService = vmPriceService;
        this.batchSize = Math.max(1, properties.cost().batchSize());
    }

    @Scheduled(fixedDelayString = "${orbit.cost.interval-ms:3600000}",
            initialDelayString = "${orbit.cost.initial-delay-ms:60000}")
    public void reconcile() {
        List<ScanDocument> candidates;
        try {
            candidates = scanRepository.findUncostedCompletedScans(ScanStatus.MANUAL,
                    PageRequest.of(0, batchSize, Sort.by(Sort.Direction.DESC, "createdAt")));
        } catch (DataAccessException e) {
            log.error("Failed to query scans awaiting cost: {}", e.getMessage());
            return;
        }
        if (candidates.isEmpty()) {
            log.debug("No scans awaiting cost");
            return;
        }

        int priced = 0;
        for (ScanDocument scan : candidates) {
            try {
                if (reconcileOne(scan)) priced++;
            } catch (RuntimeException e) {
                log.error("Unexpected error pricing scan {}: {}", scan.getScanId(), e.getMessage(), e);
            }
        }
        log.info("Cost reconciliation priced {}/{} scans", priced, candidates.size());
    }

    boolean reconcileOne(ScanDocument scan) {
        String scanId = scan.getScanId();
        if (scan.getCost() != null || scan.getStatus() == ScanStatus.MANUAL) {
            return false;
        }

        Instant vmStart;
        Instant vmStop;
        try {
            vmStart = parseTimestamp(scan.getVmStartTime());
            vmStop = parseTimestamp(scan.getVmStopTime());
        } catch (DateTimeParseException e) {
            log.warn("Skipping scan {}: unparseable VM timestamps ({})", scanId, e.getMessage());
            return false;
        }
        if (vmStop.isBefore(vmStart)) {
            log.warn("Skipping scan {}: VM stop time {} precedes start time {}", scanId, vmStop, vmStart);
            return false;
        }
        long hours = billableHours(vmStart, vmStop);

        if (scan.getVmProviderId() == null || scan.getVmProviderId().isBlank()) {
            log.warn("Skipping scan {}: no VM provider recorded", scanId);
            return false;
        }
        Optional<ProviderDocument> provider = providerRepository.findById(scan.getVmProviderId());
        if (provider.isEmpty()) {
            log.warn("Skipping scan {}: provider {} not found", scanId, scan.getVmProviderId());
            return false;
        }

        ProviderSettings settings;
        try {
            settings = ProviderSettings.from(provider.get());
        } catch (InvalidProviderSettingsException e) {
            log.warn("Skipping scan {}: {}", scanId, e.getMessage());
            return false;
        }
        Optional<String> size = settings.sizeFor(scan.getVmSize());
        if (size.isEmpty()) {
            log.warn("Skipping scan {}: no VM size on scan or provider {}", scanId, settings.providerId());
            return false;
        }

        OptionalDouble hourlyPrice;
        try {
            hourlyPrice = vmPriceService.hourlyPrice(settings, size.get());
        } catch (PricingLookupException e) {
            log.warn("Skipping scan {}: price lookup failed: {}", scanId, e.getMessage());
            return false;
        }
        if (hourlyPrice.isEmpty()) {
            log.warn("Skipping scan {}: no price for size {} in region {}", scanId, size.get(), settings.region());
            return false;
        }

        scan.setCost(hourlyPrice.getAsDouble() * hours);
        try {
            scanRepository.save(scan);
        } catch (DataAccessException e) {
            log.error("Failed to save cost for scan {}: {}", scanId, e.getMessage());
            return false;
        }
        log.info("Priced scan {}: {} h x {} = {}", scanId, hours, hourlyPrice.getAsDouble(), scan.getCost());
        return true;
    }

    /** Elapsed time in whole hours, rounded up. */
    public static long billableHours(Instant start, Instant stop) {
        long millis = Duration.between(start, stop).toMillis();
        return (millis + MILLIS_PER_HOUR - 1) / MILLIS_PER_HOUR;
    }

    /** Parses an RFC 3339 VM timestamp; blank values are rejected like malformed ones. */
    public static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            throw new DateTimeParseException("empty timestamp", String.valueOf(value), 0);
        }
        return OffsetDateTime.parse(value.trim()).toInstant();
    }
}
