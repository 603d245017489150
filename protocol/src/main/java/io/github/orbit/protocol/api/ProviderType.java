package io.github.orbit.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ProviderType {
    @JsonProperty("digitalocean") DIGITALOCEAN,
    @JsonProperty("aws") AWS,
    @JsonProperty("s3") S3,
    @JsonProperty("jira") JIRA
}
