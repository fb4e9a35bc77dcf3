package com.wgbot.application.provisioning.impl;

import com.wgbot.application.ports.RemoteHostSession;
import com.wgbot.application.provisioning.CommandFailedException;
import com.wgbot.application.provisioning.ProvisioningError;
import com.wgbot.application.provisioning.ProvisioningException;
import com.wgbot.application.provisioning.ProvisioningStage;
import com.wgbot.application.provisioning.WireguardLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The peer registry file on a live host.
 *
 * Rewrites go to a temp file in the same directory which is then renamed over the registry,
 * so a concurrent reader sees either the old or the new file. A failed read never leads to a write.
 */
public class PeerConfigStore {

    private static final Logger log = LoggerFactory.getLogger(PeerConfigStore.class);

    private final RemoteHostSession session;
    private final WireguardLayout layout;

    public PeerConfigStore(RemoteHostSession session, WireguardLayout layout) {
        this.session = session;
        this.layout = layout;
    }

    public PeerRegistry read() {
        return PeerRegistry.parse(session.run("cat " + layout.registryPath()));
    }

    /**
     * Reads the registry, treating a missing or unreadable file as one without peers.
     */
    public PeerRegistry readOrEmpty() {
        try {
            return read();
        } catch (CommandFailedException e) {
            log.debug("Registry {} not readable, assuming empty: {}", layout.registryPath(), e.getMessage());
            return PeerRegistry.empty();
        }
    }

    /**
     * Replaces the registry with {@code next} unless it is unchanged from {@code current}.
     *
     * @return true if the file was rewritten
     */
    public boolean commit(PeerRegistry current, PeerRegistry next) {
        if (current != null && current.render().equals(next.render())) {
            return false;
        }
        String tmp = layout.registryTempPath();
        session.writeFile(tmp, next.render());
        session.run("chmod 600 " + tmp + " && mv -f " + tmp + " " + layout.registryPath());
        return true;
    }

    public void appendPeer(String name, String publicKey, String address) {
        PeerRegistry current = read();
        commit(current, current.append(name, publicKey, address + "/32"));
    }

    /**
     * A missing registry or an unknown name leaves the host untouched.
     *
     * @return true if a block was removed
     */
    public boolean removePeer(String name) {
        PeerRegistry current = readOrEmpty();
        return commit(current, current.remove(name));
    }

    /**
     * @return true if the registry changed, false if the peer already was in the requested state
     * @throws ProvisioningException {@code PROVISIONING_FAILED{TOGGLE_PEER}} when no peer has that name
     */
    public boolean setBlocked(String name, boolean blocked) {
        PeerRegistry current = readOrEmpty();
        if (!current.contains(name)) {
            throw new ProvisioningException(ProvisioningError.PROVISIONING_FAILED, ProvisioningStage.TOGGLE_PEER,
                    "Client " + name + " is not registered in " + layout.registryPath(), null);
        }
        return commit(current, current.setBlocked(name, blocked));
    }

    public boolean isBlocked(String name) {
        return readOrEmpty().isBlocked(name);
    }

    public String nextFreeAddress() {
        return readOrEmpty().nextFreeAddress(layout.subnetPrefix());
    }
}
