package io.github.orbit.protocol.api;

import java.time.Instant;

public record ScheduleScanRequest(
        String scanId,
        String cronExpression,
        Instant startDate,
        Instant endDate,
        RecurrenceSpecDto scheduleDetails
) {}
