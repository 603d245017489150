package io.github.orbit.gateway.controller;

import io.github.orbit.persistence.document.ScanDocument;
import io.github.orbit.persistence.document.ScanLogDocument;
import io.github.orbit.persistence.repository.ScanLogRepository;
import io.github.orbit.persistence.repository.ScanRepository;
import io.github.orbit.protocol.api.ScanCostResponse;
import io.github.orbit.runtime.cost.ScanCostReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

@RestController
public class ScanController {

    private static final Logger log = LoggerFactory.getLogger(ScanController.class);

    private final ScanRepository scanRepository;
    private final ScanLogRepository scanLogRepository;

    public ScanController(ScanRepository scanRepository, ScanLogRepository scanLogRepository) {
        this.scanRepository = scanRepository;
        this.scanLogRepository = scanLogRepository;
    }

    @GetMapping("/api/scans/{scanId}/cost")
    public ResponseEntity<ScanCostResponse> cost(@PathVariable String scanId) {
        return scanRepository.findById(scanId)
                .map(scan -> ResponseEntity.ok(toCostResponse(scan)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/api/scans/{scanId}/logs")
    public ResponseEntity<List<ScanLogDocument>> logs(@PathVariable String scanId) {
        if (!scanRepository.existsById(scanId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(scanLogRepository.findByScanIdOrderByTimestampAsc(scanId));
    }

    private ScanCostResponse toCostResponse(ScanDocument scan) {
        Long hours = null;
        if (scan.getVmStartTime() != null && scan.getVmStopTime() != null) {
            try {
                Instant start = ScanCostReconciler.parseTimestamp(scan.getVmStartTime());
                Instant stop = ScanCostReconciler.parseTimestamp(scan.getVmStopTime());
                if (!stop.isBefore(start)) hours = ScanCostReconciler.billableHours(start, stop);
            } catch (DateTimeParseException e) {
                log.debug("Scan {} has unparseable VM timestamps: {}", scan.getScanId(), e.getMessage());
            }
        }
        return new ScanCostResponse(scan.getScanId(), scan.getStatus(), scan.getVmSize(), hours, scan.getCost());
    }
}
