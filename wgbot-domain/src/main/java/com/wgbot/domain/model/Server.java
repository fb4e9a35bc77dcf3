package com.wgbot.domain.model;

import java.util.Objects;

/**
 * A VPN host that subscriptions are provisioned on.
 * Occupancy is advisory: it is checked when a server is selected, not enforced on the host.
 */
public record Server(
        long id,
        String address,
        int sshPort,
        String sshUser,
        String sshPassword,
        int maxClients,
        int currentClients,
        boolean active
) {
    public Server {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(sshUser, "sshUser");
        if (sshPort <= 0 || sshPort > 65535) {
            throw new IllegalArgumentException("Invalid SSH port: " + sshPort);
        }
        if (maxClients < 0) {
            throw new IllegalArgumentException("maxClients must be >= 0");
        }
        if (currentClients < 0) {
            currentClients = 0;
        }
    }

    public boolean hasCapacity() {
        return active && currentClients < maxClients;
    }

    public Server withCurrentClients(int clients) {
        return new Server(id, address, sshPort, sshUser, sshPassword, maxClients, clients, active);
    }

    @Override
    public String toString() {
        return "Server[id=" + id + ", address=" + address + ":" + sshPort
                + ", user=" + sshUser + ", clients=" + currentClients + "/" + maxClients
                + ", active=" + active + "]";
    }
}
