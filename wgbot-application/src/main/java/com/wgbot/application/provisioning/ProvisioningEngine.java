package com.wgbot.application.provisioning;

import com.wgbot.domain.model.Server;

import java.nio.file.Path;

/**
 * Remote WireGuard lifecycle on provisioned hosts.
 *
 * Operations on the same server are serialized. Every operation opens its own session
 * and closes it on all paths.
 */
public interface ProvisioningEngine {

    /**
     * Installs and configures WireGuard. Idempotent: a configured host keeps its keys and registry.
     */
    void setupServer(Server server);

    /**
     * Registers a new peer and writes the client artifact locally.
     * The artifact is written only after every remote step succeeded.
     *
     * @return path of the local client config
     */
    Path createClientConfig(Server server, String clientName);

    void removeClient(Server server, String clientName);

    /**
     * Removes the peer named by the artifact's base name (".conf" stripped).
     */
    void revokeClientConfig(Server server, String configPath);

    void blockClient(Server server, String configPath);

    void unblockClient(Server server, String configPath);

    boolean isClientBlocked(Server server, String configPath);

    ServerInspection inspectServer(Server server);
}
