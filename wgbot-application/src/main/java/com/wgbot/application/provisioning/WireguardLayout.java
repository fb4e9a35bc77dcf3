package com.wgbot.application.provisioning;

import java.time.Duration;
import java.util.Objects;

/**
 * Interface naming, paths and tunables of the managed WireGuard deployment.
 */
public record WireguardLayout(
        String interfaceName,
        String configDir,
        String subnetPrefix,
        int listenPort,
        String clientDns,
        int persistentKeepalive,
        Duration connectTimeout,
        Duration setupTimeout
) {
    public WireguardLayout {
        Objects.requireNonNull(interfaceName, "interfaceName");
        Objects.requireNonNull(configDir, "configDir");
        Objects.requireNonNull(subnetPrefix, "subnetPrefix");
        if (subnetPrefix.split("\\.").length != 3) {
            throw new IllegalArgumentException("subnetPrefix must have three octets, e.g. 10.0.0");
        }
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(30);
        if (setupTimeout == null) setupTimeout = Duration.ofSeconds(30);
        if (clientDns == null || clientDns.isBlank()) clientDns = "8.8.8.8, 1.1.1.1";
    }

    public static WireguardLayout defaults() {
        return new WireguardLayout("wg0", "/etc/wireguard", "10.0.0", 51820, "8.8.8.8, 1.1.1.1", 25,
                Duration.ofSeconds(30), Duration.ofSeconds(30));
    }

    public String registryPath() {
        return configDir + "/" + interfaceName + ".conf";
    }

    public String registryTempPath() {
        return registryPath() + ".tmp";
    }

    public String serverPrivateKeyPath() {
        return configDir + "/server_private.key";
    }

    public String serverPublicKeyPath() {
        return configDir + "/server_public.key";
    }

    public String serviceUnit() {
        return "wg-quick@" + interfaceName;
    }

    public String serverAddress() {
        return subnetPrefix + ".1/24";
    }
}
