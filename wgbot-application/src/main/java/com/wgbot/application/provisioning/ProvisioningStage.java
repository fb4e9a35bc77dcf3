package com.wgbot.application.provisioning;

/**
 * Step of a provisioning operation, attached to PROVISIONING_FAILED errors.
 */
public enum ProvisioningStage {
    CONNECT,
    INSTALL,
    GENERATE_SERVER_KEYS,
    WRITE_SERVER_CONFIG,
    START_SERVICE,
    UNIQUE_NAME,
    GENERATE_KEYS,
    SERVER_INFO,
    ALLOCATE_ADDRESS,
    APPEND_PEER,
    REMOVE_PEER,
    TOGGLE_PEER,
    RESTART_SERVICE,
    WRITE_ARTIFACT
}
