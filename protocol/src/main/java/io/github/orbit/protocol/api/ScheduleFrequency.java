package io.github.orbit.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ScheduleFrequency {
    @JsonProperty("daily") DAILY,
    @JsonProperty("weekly") WEEKLY,
    @JsonProperty("monthly") MONTHLY
}
