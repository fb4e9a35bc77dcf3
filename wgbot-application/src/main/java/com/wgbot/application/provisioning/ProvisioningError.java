package com.wgbot.application.provisioning;

public enum ProvisioningError {
    UNREACHABLE,
    AUTH_FAILED,
    PRIVILEGE_DENIED,
    COMMAND_FAILED,
    SETUP_TIMEOUT,
    UNSUPPORTED_OS,
    INTERFACE_VERIFICATION_FAILED,
    INVALID_CONFIG_PATH,
    PROVISIONING_FAILED,
    NO_CAPACITY;

    /**
     * Errors raised before any remote command could run.
     */
    public boolean isTransport() {
        return this == UNREACHABLE || this == AUTH_FAILED || this == PRIVILEGE_DENIED;
    }
}
