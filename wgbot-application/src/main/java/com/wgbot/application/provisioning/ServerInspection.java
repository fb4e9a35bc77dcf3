package com.wgbot.application.provisioning;

/**
 * Read-only health snapshot of a host.
 */
public record ServerInspection(long serverId, boolean wireguardInstalled, boolean registryPresent, int peerCount) {
}
