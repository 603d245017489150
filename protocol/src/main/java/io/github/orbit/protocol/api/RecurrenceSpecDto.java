package io.github.orbit.protocol.api;

import java.util.List;

public record RecurrenceSpecDto(
        ScheduleFrequency frequency,
        List<String> selectedDays,
        MonthlyType monthlyType,
        Integer monthlyDate,
        String monthlyDay,
        String monthlyWeek
) {}
