package com.wgbot.application.ports;

import com.wgbot.domain.model.Server;

import java.util.Objects;

/**
 * Connection coordinates for a remote host.
 */
public record HostEndpoint(String address, int port, String user, String password) {

    public HostEndpoint {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(user, "user");
    }

    public static HostEndpoint of(Server server) {
        return new HostEndpoint(server.address(), server.sshPort(), server.sshUser(), server.sshPassword());
    }

    public boolean isRoot() {
        return "root".equals(user);
    }

    @Override
    public String toString() {
        return user + "@" + address + ":" + port;
    }
}
