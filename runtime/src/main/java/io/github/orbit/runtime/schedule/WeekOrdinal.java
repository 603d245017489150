package io.github.orbit.runtime.schedule;

import java.util.Locale;
import java.util.Optional;

/** Occurrence of a weekday within a month, with its cron day-of-week qualifier. */
enum WeekOrdinal {
    FIRST("#1"),
    SECOND("#2"),
    THIRD("#3"),
    FOURTH("#4"),
    LAST("L");

    private final String cronSuffix;

    WeekOrdinal(String cronSuffix) {
        this.cronSuffix = cronSuffix;
    }

    String cronSuffix() {
        return cronSuffix;
    }

    static Optional<WeekOrdinal> fromName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
