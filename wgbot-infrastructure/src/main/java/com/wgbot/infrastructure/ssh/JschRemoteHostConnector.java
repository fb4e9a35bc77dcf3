package com.wgbot.infrastructure.ssh;

import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.wgbot.application.ports.HostEndpoint;
import com.wgbot.application.ports.RemoteHostConnector;
import com.wgbot.application.ports.RemoteHostSession;
import com.wgbot.application.provisioning.CommandFailedException;
import com.wgbot.application.provisioning.ProvisioningError;
import com.wgbot.application.provisioning.ProvisioningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Password-authenticated SSH sessions via JSch.
 *
 * After authentication the account is probed for privilege: root must report uid 0,
 * any other user must be able to run {@code sudo -n true}.
 */
public class JschRemoteHostConnector implements RemoteHostConnector {

    private static final Logger log = LoggerFactory.getLogger(JschRemoteHostConnector.class);

    private final SshSettings settings;

    public JschRemoteHostConnector(SshSettings settings) {
        this.settings = settings;
    }

    @Override
    public RemoteHostSession connect(HostEndpoint endpoint, Duration timeout) {
        Session session = null;
        try {
            JSch jsch = new JSch();
            if (settings.knownHostsFile() != null && !settings.knownHostsFile().isBlank()) {
                jsch.setKnownHosts(settings.knownHostsFile());
            }
            session = jsch.getSession(endpoint.user(), endpoint.address(), endpoint.port());
            session.setPassword(endpoint.password());
            session.setConfig("StrictHostKeyChecking", settings.strictHostKeyChecking());
            session.setConfig("PreferredAuthentications", "password,keyboard-interactive");
            session.setServerAliveInterval(15_000);
            session.connect(Math.toIntExact(timeout.toMillis()));
        } catch (JSchException e) {
            disconnectQuietly(session);
            throw classify(endpoint, e);
        }

        JschRemoteHostSession remote = new JschRemoteHostSession(session, !endpoint.isRoot(), settings.channelTimeout());
        try {
            probePrivilege(endpoint, remote, session);
        } catch (RuntimeException e) {
            remote.close();
            throw e;
        }
        log.debug("SSH session established to {}", endpoint);
        return remote;
    }

    private static void probePrivilege(HostEndpoint endpoint, JschRemoteHostSession remote, Session session) {
        try {
            if (endpoint.isRoot()) {
                String uid = remote.runRaw("id -u").strip();
                if (!"0".equals(uid)) {
                    throw new ProvisioningException(ProvisioningError.PRIVILEGE_DENIED,
                            "Account " + endpoint.user() + " on " + endpoint.address() + " is not uid 0");
                }
            } else {
                remote.runRaw("sudo -n true");
            }
        } catch (CommandFailedException e) {
            throw new ProvisioningException(ProvisioningError.PRIVILEGE_DENIED,
                    "Account " + endpoint.user() + " on " + endpoint.address() + " cannot run privileged commands: " + e.stderr(), e);
        }
    }

    static ProvisioningException classify(HostEndpoint endpoint, JSchException e) {
        String message = e.getMessage() == null ? "" : e.getMessage();
        if (message.toLowerCase(Locale.ROOT).startsWith("auth")) {
            return new ProvisioningException(ProvisioningError.AUTH_FAILED,
                    "Authentication failed for " + endpoint, e);
        }
        return new ProvisioningException(ProvisioningError.UNREACHABLE,
                "Cannot reach " + endpoint + ": " + message, e);
    }

    private static void disconnectQuietly(Session session) {
        if (session != null && session.isConnected()) {
            session.disconnect();
        }
    }
}
