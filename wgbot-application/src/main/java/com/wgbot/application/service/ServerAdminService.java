package com.wgbot.application.service;

import com.wgbot.application.ports.ServerStorePort;
import com.wgbot.application.provisioning.ProvisioningEngine;
import com.wgbot.application.provisioning.ServerInspection;
import com.wgbot.domain.model.Server;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server-level admin actions: setup and health inspection with occupancy sync.
 */
public class ServerAdminService {

    private static final Logger log = LoggerFactory.getLogger(ServerAdminService.class);

    private final ServerStorePort servers;
    private final ProvisioningEngine engine;

    public ServerAdminService(ServerStorePort servers, ProvisioningEngine engine) {
        this.servers = servers;
        this.engine = engine;
    }

    public void setup(long serverId) {
        engine.setupServer(servers.getServerById(serverId));
    }

    /**
     * Inspects the host and stores its real peer count as the server occupancy.
     */
    public ServerInspection inspect(long serverId) {
        Server server = servers.getServerById(serverId);
        ServerInspection inspection = engine.inspectServer(server);
        if (inspection.registryPresent() && inspection.peerCount() != server.currentClients()) {
            log.info("Server {} occupancy {} differs from host peer count {}, syncing",
                    serverId, server.currentClients(), inspection.peerCount());
            servers.updateServer(server.withCurrentClients(inspection.peerCount()));
        }
        return inspection;
    }
}
