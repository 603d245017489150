package io.github.orbit.runtime.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OrbitPropertiesTest {

    @Test
    void bindsDefaultsWhenNothingIsSet() {
        OrbitProperties properties = bind(Map.of());

        assertThat(properties.ansible().executable()).isEqualTo("ansible-playbook");
        assertThat(properties.ansible().timeoutMinutes()).isEqualTo(120);
        assertThat(properties.scheduler().enabled()).isTrue();
        assertThat(properties.scheduler().zone()).isEqualTo("UTC");
        assertThat(properties.scheduler().poolSize()).isEqualTo(2);
        assertThat(properties.cost().batchSize()).isEqualTo(100);
        assertThat(properties.pricing().digitalocean().baseUrl()).isEqualTo("https://api.digitalocean.com");
    }

    @Test
    void reconcilerTimingKeysLiveAlongsideBoundCostSettings() {
        OrbitProperties properties = bind(Map.of(
                "orbit.cost.interval-ms", "60000",
                "orbit.cost.initial-delay-ms", "1000",
                "orbit.cost.batch-size", "25",
                "orbit.scheduler.zone", "Europe/Berlin"));

        assertThat(properties.cost().batchSize()).isEqualTo(25);
        assertThat(properties.scheduler().zone()).isEqualTo("Europe/Berlin");
    }

    private static OrbitProperties bind(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
                .bindOrCreate("orbit", OrbitProperties.class);
    }
}
