package io.github.orbit.runtime.provisioning;

import java.nio.file.Path;

/**
 * Everything the provisioning playbook needs to stand up one scan's infrastructure.
 */
public record ProvisioningRequest(
        Path playbook,
        Path logDir,
        Path scanDefinition,
        Path inventory,
        Path basePath,
        String scanId
) {}
