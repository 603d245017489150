package io.github.orbit.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Whether a monthly recurrence pins a calendar date or an ordinal weekday. */
public enum MonthlyType {
    @JsonProperty("date") DATE,
    @JsonProperty("day") DAY
}
