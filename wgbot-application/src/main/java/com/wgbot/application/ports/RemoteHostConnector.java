package com.wgbot.application.ports;

import java.time.Duration;

/**
 * Opens authenticated, privileged command sessions on remote hosts.
 */
public interface RemoteHostConnector {

    /**
     * Connects, authenticates and probes that the account may run privileged commands.
     *
     * @throws com.wgbot.application.provisioning.ProvisioningException with code
     *         UNREACHABLE, AUTH_FAILED or PRIVILEGE_DENIED. No transport is left open on failure.
     */
    RemoteHostSession connect(HostEndpoint endpoint, Duration timeout);
}
