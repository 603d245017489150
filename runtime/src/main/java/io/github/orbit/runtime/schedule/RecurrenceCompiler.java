package io.github.orbit.runtime.schedule;

import io.github.orbit.persistence.document.ScheduledScanDocument;
import io.github.orbit.persistence.document.ScheduledScanDocument.ScheduleDetails;
import io.github.orbit.protocol.api.MonthlyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Turns a human-authored recurrence into a six-field Spring cron expression
 * ({@code second minute hour day-of-month month day-of-week}). Every recurrence fires
 * at midnight. Day-of-week numbers are cron's: Sunday=0 through Saturday=6.
 *
 * <p>Monthly ordinal-weekday recurrences use the Quartz-style qualifiers that
 * {@link org.springframework.scheduling.support.CronExpression} understands:
 * {@code d#n} for the n-th weekday d of the month and {@code dL} for the last one.
 *
 * <p>Calendar feasibility is not checked: a monthly date of 31 compiles and simply
 * never fires in shorter months.
 */
@Component
public class RecurrenceCompiler {

    private static final Logger log = LoggerFactory.getLogger(RecurrenceCompiler.class);

    static final String MIDNIGHT = "0 0 0";

    /**
     * Resolves the expression a persisted schedule fires on. An explicit cron expression
     * wins and is returned verbatim; otherwise the recurrence is compiled.
     */
    public String resolve(ScheduledScanDocument schedule) throws RecurrenceCompileException {
        if (schedule.hasExplicitCron()) {
            return schedule.getCronExpression().trim();
        }
        return compile(schedule.getScheduleDetails());
    }

    public String compile(ScheduleDetails details) throws RecurrenceCompileException {
        if (details == null) {
            throw new RecurrenceCompileException("No recurrence and no cron expression");
        }
        if (details.getFrequency() == null) {
            throw new RecurrenceCompileException("Recurrence has no frequency");
        }
        return switch (details.getFrequency()) {
            case DAILY -> MIDNIGHT + " * * *";
            case WEEKLY -> compileWeekly(details.getSelectedDays());
            case MONTHLY -> compileMonthly(details);
        };
    }

    private String compileWeekly(List<String> selectedDays) throws RecurrenceCompileException {
        if (selectedDays == null || selectedDays.isEmpty()) {
            throw new RecurrenceCompileException("Weekly recurrence has no selected days");
        }
        SortedSet<Integer> days = new TreeSet<>();
        for (String name : selectedDays) {
            Optional<Integer> day = cronDayOfWeek(name);
            if (day.isPresent()) {
                days.add(day.get());
            } else {
                log.warn("Ignoring unrecognized weekday '{}' in weekly recurrence", name);
            }
        }
        if (days.isEmpty()) {
            throw new RecurrenceCompileException("Weekly recurrence has no recognizable days: " + selectedDays);
        }
        String joined = days.stream().map(String::valueOf).collect(Collectors.joining(","));
        return MIDNIGHT + " * * " + joined;
    }

    private String compileMonthly(ScheduleDetails details) throws RecurrenceCompileException {
        MonthlyType type = details.getMonthlyType();
        if (type == MonthlyType.DATE) {
            Integer date = details.getMonthlyDate();
            if (date == null || date <= 0 || date > 31) {
                throw new RecurrenceCompileException("Monthly date recurrence needs a day of month 1-31, got " + date);
            }
            return MIDNIGHT + " " + date + " * *";
        }
        if (type == MonthlyType.DAY) {
            Integer day = cronDayOfWeek(details.getMonthlyDay()).orElseThrow(() ->
                    new RecurrenceCompileException("Unrecognized monthly weekday: " + details.getMonthlyDay()));
            WeekOrdinal ordinal = WeekOrdinal.fromName(details.getMonthlyWeek()).orElseThrow(() ->
                    new RecurrenceCompileException("Unrecognized monthly week: " + details.getMonthlyWeek()));
            return MIDNIGHT + " * * " + day + ordinal.cronSuffix();
        }
        throw new RecurrenceCompileException("Monthly recurrence has no monthly type");
    }

    static Optional<Integer> cronDayOfWeek(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        try {
            DayOfWeek day = DayOfWeek.valueOf(name.trim().toUpperCase(Locale.ROOT));
            return Optional.of(day.getValue() % 7);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
