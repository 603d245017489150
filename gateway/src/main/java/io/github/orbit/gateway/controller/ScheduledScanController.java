package io.github.orbit.gateway.controller;

import io.github.orbit.persistence.document.ScheduledScanDocument;
import io.github.orbit.persistence.document.ScheduledScanDocument.ScheduleDetails;
import io.github.orbit.persistence.repository.ScanRepository;
import io.github.orbit.persistence.repository.ScheduledScanRepository;
import io.github.orbit.protocol.api.RecurrenceSpecDto;
import io.github.orbit.protocol.api.ScheduleScanRequest;
import io.github.orbit.protocol.api.ScheduledScanResponse;
import io.github.orbit.runtime.schedule.RecurrenceCompileException;
import io.github.orbit.runtime.schedule.RecurrenceCompiler;
import io.github.orbit.runtime.schedule.ScanScheduleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/scheduled-scans")
public class ScheduledScanController {

    private static final Logger log = LoggerFactory.getLogger(ScheduledScanController.class);

    private final ScheduledScanRepository scheduledScanRepository;
    private final ScanRepository scanRepository;
    private final RecurrenceCompiler compiler;
    private final ScanScheduleRegistry registry;

    public ScheduledScanController(ScheduledScanRepository scheduledScanRepository,
                                   ScanRepository scanRepository,
                                   RecurrenceCompiler compiler,
                                   ScanScheduleRegistry registry) {
        this.scheduledScanRepository = scheduledScanRepository;
        this.scanRepository = scanRepository;
        this.compiler = compiler;
        this.registry = registry;
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody ScheduleScanRequest req) {
        if (req.scanId() == null || req.scanId().isBlank()) {
            return error(HttpStatus.BAD_REQUEST, "scanId is required");
        }
        if (req.startDate() == null) {
            return error(HttpStatus.BAD_REQUEST, "startDate is required");
        }
        boolean hasCron = req.cronExpression() != null && !req.cronExpression().isBlank();
        if (!hasCron && req.scheduleDetails() == null) {
            return error(HttpStatus.BAD_REQUEST, "Either scheduleDetails or cronExpression is required");
        }
        if (req.endDate() != null && req.endDate().isBefore(req.startDate())) {
            return error(HttpStatus.BAD_REQUEST, "endDate must not be before startDate");
        }
        if (!scanRepository.existsById(req.scanId())) {
            return error(HttpStatus.NOT_FOUND, "Scan not found: " + req.scanId());
        }

        ScheduledScanDocument doc = new ScheduledScanDocument();
        doc.setId(UUID.randomUUID().toString());
        doc.setScanId(req.scanId());
        doc.setCronExpression(hasCron ? req.cronExpression().trim() : null);
        doc.setScheduleDetails(toDetails(req.scheduleDetails()));
        doc.setStartDate(req.startDate());
        doc.setEndDate(req.endDate());
        doc.setCreatedAt(Instant.now());

        String cron;
        try {
            cron = compiler.resolve(doc);
        } catch (RecurrenceCompileException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        if (!CronExpression.isValidExpression(cron)) {
            return error(HttpStatus.BAD_REQUEST, "Invalid cron expression: " + cron);
        }

        scheduledScanRepository.save(doc);
        if (registry.isRunning()) {
            registry.register(doc);
        }
        log.info("Created schedule {} for scan {} ({})", doc.getId(), doc.getScanId(), cron);
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(doc));
    }

    @GetMapping
    public List<ScheduledScanResponse> list(@RequestParam(required = false) String scanId) {
        List<ScheduledScanDocument> docs = scanId != null
                ? scheduledScanRepository.findByScanId(scanId)
                : scheduledScanRepository.findAll();
        return docs.stream().map(this::toResponse).collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ScheduledScanResponse> get(@PathVariable String id) {
        return scheduledScanRepository.findById(id)
                .map(doc -> ResponseEntity.ok(toResponse(doc)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (!scheduledScanRepository.existsById(id)) {
            return ResponseEntity.notFound().build();
        }
        registry.cancel(id);
        scheduledScanRepository.deleteById(id);
        log.info("Deleted schedule {}", id);
        return ResponseEntity.noContent().build();
    }

    // --- Mappers ---

    private ScheduledScanResponse toResponse(ScheduledScanDocument doc) {
        Instant nextFireAt = null;
        if (!doc.isExpired(Instant.now())) {
            try {
                nextFireAt = registry.nextFireTime(compiler.resolve(doc)).orElse(null);
            } catch (RecurrenceCompileException e) {
                log.debug("Schedule {} does not compile: {}", doc.getId(), e.getMessage());
            }
        }
        return new ScheduledScanResponse(
                doc.getId(),
                doc.getScanId(),
                doc.getCronExpression(),
                toDto(doc.getScheduleDetails()),
                doc.getStartDate(),
                doc.getEndDate(),
                registry.isRegistered(doc.getId()),
                nextFireAt,
                doc.getCreatedAt()
        );
    }

    static ScheduleDetails toDetails(RecurrenceSpecDto dto) {
        if (dto == null) return null;
        ScheduleDetails details = new ScheduleDetails();
        details.setFrequency(dto.frequency());
        details.setSelectedDays(dto.selectedDays());
        details.setMonthlyType(dto.monthlyType());
        details.setMonthlyDate(dto.monthlyDate());
        details.setMonthlyDay(dto.monthlyDay());
        details.setMonthlyWeek(dto.monthlyWeek());
        return details;
    }

    static RecurrenceSpecDto toDto(ScheduleDetails details) {
        if (details == null) return null;
        return new RecurrenceSpecDto(
                details.getFrequency(),
                details.getSelectedDays(),
                details.getMonthlyType(),
                details.getMonthlyDate(),
                details.getMonthlyDay(),
                details.getMonthlyWeek()
        );
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
