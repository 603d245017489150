package io.github.orbit.protocol.api;

import java.time.Instant;

public record ScheduledScanResponse(
        String id,
        String scanId,
        String cronExpression,
        RecurrenceSpecDto scheduleDetails,
        Instant startDate,
        Instant endDate,
        boolean registered,
        Instant nextFireAt,
        Instant createdAt
) {}
