package io.github.orbit.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Typed view of the {@code orbit.*} configuration tree.
 */
@ConfigurationProperties(prefix = "orbit")
public record OrbitProperties(
        @DefaultValue Ansible ansible,
        @DefaultValue Scheduler scheduler,
        @DefaultValue Cost cost,
        @DefaultValue Pricing pricing
) {

    public record Ansible(
            @DefaultValue("./ansible") String basePath,
            @DefaultValue("ansible-playbook") String executable,
            @DefaultValue("120") long timeoutMinutes
    ) {}

    public record Scheduler(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("UTC") String zone,
            @DefaultValue("2") int poolSize
    ) {}

    /**
     * {@code orbit.cost.interval-ms} and {@code orbit.cost.initial-delay-ms} are read by the
     * reconciler's {@code @Scheduled} placeholders, not bound here.
     */
    public record Cost(
            @DefaultValue("100") int batchSize
    ) {}

    public record Pricing(
            @DefaultValue DigitalOcean digitalocean
    ) {}

    public record DigitalOcean(
            @DefaultValue("https://api.digitalocean.com") String baseUrl
    ) {}
}
