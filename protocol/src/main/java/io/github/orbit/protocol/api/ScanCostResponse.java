package io.github.orbit.protocol.api;

public record ScanCostResponse(
        String scanId,
        ScanStatus status,
        String vmSize,
        Long billableHours,
        Double cost
) {}
