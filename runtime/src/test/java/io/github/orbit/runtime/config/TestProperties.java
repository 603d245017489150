package io.github.orbit.runtime.config;

import java.nio.file.Path;

public final class TestProperties {

    private TestProperties() {}

    public static OrbitProperties defaults() {
        return withAnsible(Path.of("./ansible"), "ansible-playbook", 120);
    }

    public static OrbitProperties withAnsible(Path basePath, String executable, long timeoutMinutes) {
        return new OrbitProperties(
                new OrbitProperties.Ansible(basePath.toString(), executable, timeoutMinutes),
                new OrbitProperties.Scheduler(true, "UTC", 2),
                new OrbitProperties.Cost(100),
                new OrbitProperties.Pricing(new OrbitProperties.DigitalOcean("https://api.digitalocean.com")));
    }

    public static OrbitProperties withPricingBaseUrl(String baseUrl) {
        OrbitProperties d = defaults();
        return new OrbitProperties(d.ansible(), d.scheduler(), d.cost(),
                new OrbitProperties.Pricing(new OrbitProperties.DigitalOcean(baseUrl)));
    }
}
