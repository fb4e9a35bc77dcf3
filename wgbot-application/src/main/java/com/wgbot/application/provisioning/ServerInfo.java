package com.wgbot.application.provisioning;

/**
 * Facts a client needs to reach a server. Read from the host on demand, never stored.
 */
public record ServerInfo(String publicKey, String publicIp, int listenPort) {

    public String endpoint() {
        return publicIp + ":" + listenPort;
    }
}
