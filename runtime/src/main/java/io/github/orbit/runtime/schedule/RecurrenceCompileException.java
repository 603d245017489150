package io.github.orbit.runtime.schedule;

/**
 * A recurrence that fails its frequency-specific field checks and
 * therefore has no cron expression.
 */
public class RecurrenceCompileException extends Exception {

    public RecurrenceCompileException(String message) {
        super(message);
    }
}
