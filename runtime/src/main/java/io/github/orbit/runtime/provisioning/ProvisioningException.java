package io.github.orbit.runtime.provisioning;

public class ProvisioningException extends Exception {

    private final String scanId;

    public ProvisioningException(String scanId, String message) {
        super(message);
        this.scanId = scanId;
    }

    public ProvisioningException(String scanId, String message, Throwable cause) {
        super(message, cause);
        this.scanId = scanId;
    }

    public String getScanId() { return scanId; }
}
