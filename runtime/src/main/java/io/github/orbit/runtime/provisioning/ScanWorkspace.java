package io.github.orbit.runtime.provisioning;

import io.github.orbit.runtime.config.OrbitProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Lays out the per-scan automation workspace: {@code <base>/scans/<scanId>/} holding
 * {@code deploy.yml}, {@code scan.yaml}, {@code inventory} and a {@code logs/} directory.
 */
@Component
public class ScanWorkspace {

    private final Path basePath;

    @Autowired
    public ScanWorkspace(OrbitProperties properties) {
        this(Path.of(properties.ansible().basePath()));
    }

    ScanWorkspace(Path basePath) {
        this.basePath = basePath.toAbsolutePath().normalize();
    }

    public ProvisioningRequest deployRequest(String scanId) {
        Path scanDir = basePath.resolve("scans").resolve(scanId);
        return new ProvisioningRequest(
                scanDir.resolve("deploy.yml"),
                scanDir.resolve("logs"),
                scanDir.resolve("scan.yaml"),
                scanDir.resolve("inventory"),
                basePath,
                scanId);
    }

    public Path basePath() {
        return basePath;
    }
}
