package io.github.orbit.protocol.api;

public enum ScanStatus {
    IDLE,
    DEPLOYING,
    RUNNING,
    FAILED,
    STOPPED,
    MANUAL
}
