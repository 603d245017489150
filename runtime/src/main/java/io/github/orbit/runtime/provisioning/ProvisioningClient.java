package io.github.orbit.runtime.provisioning;

/**
 * Stands up a scan's infrastructure. Blocks the calling thread until the
 * automation has either succeeded or failed.
 */
public interface ProvisioningClient {

    void execute(ProvisioningRequest request) throws ProvisioningException;
}
