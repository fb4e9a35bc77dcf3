package com.wgbot.application.provisioning.impl;

import com.wgbot.application.ports.HostEndpoint;
import com.wgbot.application.ports.RemoteHostConnector;
import com.wgbot.application.ports.RemoteHostSession;
import com.wgbot.application.provisioning.CommandFailedException;
import com.wgbot.application.provisioning.ProvisioningEngine;
import com.wgbot.application.provisioning.ProvisioningError;
import com.wgbot.application.provisioning.ProvisioningException;
import com.wgbot.application.provisioning.ProvisioningStage;
import com.wgbot.application.provisioning.ServerInfo;
import com.wgbot.application.provisioning.ServerInspection;
import com.wgbot.application.provisioning.WireguardLayout;
import com.wgbot.domain.model.Server;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Drives WireGuard on remote hosts through {@link RemoteHostSession} commands.
 */
public class WireguardProvisioningEngine implements ProvisioningEngine, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WireguardProvisioningEngine.class);

    private static final String DEFAULT_EGRESS_INTERFACE = "eth0";
    private static final Pattern PUBLIC_IP = Pattern.compile("[0-9A-Fa-f:.]{3,45}");
    private static final int MAX_NAME_SUFFIX = 1000;

    private final RemoteHostConnector connector;
    private final WireguardLayout layout;
    private final ClientArtifactStore artifacts;
    private final HostLocks locks = new HostLocks();
    private final ExecutorService connectExecutor;

    public WireguardProvisioningEngine(RemoteHostConnector connector, WireguardLayout layout, ClientArtifactStore artifacts) {
        this.connector = connector;
        this.layout = layout;
        this.artifacts = artifacts;
        AtomicInteger seq = new AtomicInteger();
        this.connectExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "wgbot-ssh-connect-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /* =========================
       Server setup
       ========================= */

    @Override
    public void setupServer(Server server) {
        locks.withLock(server.id(), () -> {
            log.info("Setting up WireGuard on server {}", server);
            try (RemoteHostSession session = connectWithin(server, layout.setupTimeout())) {
                ensureInstalled(session);
                session.run("mkdir -p " + layout.configDir());

                boolean registryPresent = fileExists(session, layout.registryPath());
                boolean publicKeyPresent = fileExists(session, layout.serverPublicKeyPath());
                PeerConfigStore store = new PeerConfigStore(session, layout);
                PeerRegistry existing = registryPresent ? store.read() : null;
                boolean interfacePresent = existing != null && existing.hasInterfaceSection();

                if (interfacePresent && publicKeyPresent) {
                    log.info("Server {} already configured, verifying interface only", server.id());
                } else {
                    String privateKey = stage(ProvisioningStage.GENERATE_SERVER_KEYS,
                            () -> ensureServerKeys(session, existing));
                    if (!interfacePresent) {
                        stageRun(ProvisioningStage.WRITE_SERVER_CONFIG, () -> {
                            String egress = detectEgressInterface(session);
                            String base = baseConfig(privateKey, egress);
                            PeerRegistry next = existing == null
                                    ? PeerRegistry.parse(base)
                                    : existing.withInterfaceSection(base);
                            store.commit(existing, next);
                        });
                    }
                }
                stageRun(ProvisioningStage.WRITE_SERVER_CONFIG, () -> session.run(
                        "echo 'net.ipv4.ip_forward=1' > /etc/sysctl.d/99-wireguard.conf"
                                + " && sysctl -p /etc/sysctl.d/99-wireguard.conf"));

                stageRun(ProvisioningStage.START_SERVICE, () -> session.run(
                        "systemctl enable " + layout.serviceUnit() + " && systemctl start " + layout.serviceUnit()));
                verifyInterface(session);
            }
            log.info("Server {} ready", server.id());
        });
    }

    private void ensureInstalled(RemoteHostSession session) {
        if (commandSucceeds(session, "command -v wg")) return;

        String osRelease;
        try {
            osRelease = session.run("cat /etc/os-release");
        } catch (CommandFailedException e) {
            osRelease = "";
        }
        OsFamily family = OsFamily.classify(osRelease);
        InstallPlan plan = InstallPlan.forFamily(family);
        log.info("WireGuard missing, installing for OS family {}", family);

        for (String cmd : plan.bestEffort()) {
            try {
                session.run(cmd);
            } catch (CommandFailedException e) {
                log.warn("Optional install step failed ({}): {}", cmd, e.getMessage());
            }
        }

        if (plan.firstSuccessWins()) {
            boolean installed = false;
            for (String cmd : plan.steps()) {
                if (commandSucceeds(session, cmd)) {
                    installed = true;
                    break;
                }
            }
            if (!installed) {
                throw new ProvisioningException(ProvisioningError.UNSUPPORTED_OS,
                        "No supported package manager found on host");
            }
        } else {
            stageRun(ProvisioningStage.INSTALL, () -> plan.steps().forEach(session::run));
        }

        if (!commandSucceeds(session, "command -v wg")) {
            throw new ProvisioningException(ProvisioningError.PROVISIONING_FAILED, ProvisioningStage.INSTALL,
                    "wg is still missing after installing for " + family, null);
        }
    }

    /**
     * Server keys are generated at most once per host. An existing registry key is reused.
     */
    private String ensureServerKeys(RemoteHostSession session, PeerRegistry registry) {
        String priv = layout.serverPrivateKeyPath();
        String pub = layout.serverPublicKeyPath();

        if (fileExists(session, priv) && fileExists(session, pub)) {
            return session.run("cat " + priv).strip();
        }
        String fromRegistry = registry == null ? null : registry.privateKey().orElse(null);
        if (fromRegistry != null) {
            log.info("Reusing interface private key found in {}", layout.registryPath());
            session.run("umask 077 && echo '" + fromRegistry + "' > " + priv);
            session.run("wg pubkey < " + priv + " > " + pub);
            return fromRegistry;
        }
        session.run("umask 077 && wg genkey | tee " + priv + " | wg pubkey > " + pub);
        return session.run("cat " + priv).strip();
    }

    private String detectEgressInterface(RemoteHostSession session) {
        try {
            String iface = session.run("ip -o -4 route show to default | awk '{print $5}' | head -1").strip();
            return iface.isEmpty() ? DEFAULT_EGRESS_INTERFACE : iface;
        } catch (CommandFailedException e) {
            log.warn("Default route lookup failed, using {}: {}", DEFAULT_EGRESS_INTERFACE, e.getMessage());
            return DEFAULT_EGRESS_INTERFACE;
        }
    }

    private String baseConfig(String privateKey, String egress) {
        String wg = layout.interfaceName();
        return "[Interface]\n"
                + "PrivateKey = " + privateKey + "\n"
                + "Address = " + layout.serverAddress() + "\n"
                + "ListenPort = " + layout.listenPort() + "\n"
                + "PostUp = iptables -A FORWARD -i " + wg + " -j ACCEPT; iptables -t nat -A POSTROUTING -o " + egress + " -j MASQUERADE\n"
                + "PostDown = iptables -D FORWARD -i " + wg + " -j ACCEPT; iptables -t nat -D POSTROUTING -o " + egress + " -j MASQUERADE\n";
    }

    private void verifyInterface(RemoteHostSession session) {
        try {
            session.run("ip link show " + layout.interfaceName());
        } catch (CommandFailedException e) {
            throw new ProvisioningException(ProvisioningError.INTERFACE_VERIFICATION_FAILED,
                    "Interface " + layout.interfaceName() + " is not up: " + e.stderr(), e);
        }
    }

    /* =========================
       Client lifecycle
       ========================= */

    @Override
    public Path createClientConfig(Server server, String clientName) {
        if (!PeerRegistry.isValidClientName(clientName)) {
            throw new IllegalArgumentException("Invalid client name: " + clientName);
        }
        return locks.withLock(server.id(), () -> {
            try (RemoteHostSession session = open(server)) {
                PeerConfigStore store = new PeerConfigStore(session, layout);

                String name = stage(ProvisioningStage.UNIQUE_NAME, () -> uniqueName(store.readOrEmpty(), clientName));
                ClientKeys keys = stage(ProvisioningStage.GENERATE_KEYS, () -> generateClientKeys(session));
                ServerInfo info = stage(ProvisioningStage.SERVER_INFO, () -> serverInfo(session, store, server));
                String address = stage(ProvisioningStage.ALLOCATE_ADDRESS, store::nextFreeAddress);
                stageRun(ProvisioningStage.APPEND_PEER, () -> store.appendPeer(name, keys.publicKey(), address));
                stageRun(ProvisioningStage.RESTART_SERVICE, () -> restart(session));

                Path artifact = stage(ProvisioningStage.WRITE_ARTIFACT,
                        () -> artifacts.write(name, clientConfig(keys, address, info)));
                log.info("Client {} provisioned on server {} with address {}", name, server.id(), address);
                return artifact;
            }
        });
    }

    private String uniqueName(PeerRegistry registry, String requested) {
        if (!registry.contains(requested)) return requested;
        for (int i = 2; i < MAX_NAME_SUFFIX; i++) {
            String candidate = requested + "_" + i;
            if (!registry.contains(candidate)) {
                log.info("Client name {} is taken, using {}", requested, candidate);
                return candidate;
            }
        }
        throw new IllegalStateException("No free name variant for " + requested);
    }

    private ClientKeys generateClientKeys(RemoteHostSession session) {
        String privateKey = session.run("wg genkey").strip();
        if (!PeerRegistry.isValidKey(privateKey)) {
            throw new IllegalStateException("wg genkey returned an unexpected value");
        }
        String publicKey = session.run("echo '" + privateKey + "' | wg pubkey").strip();
        if (!PeerRegistry.isValidKey(publicKey)) {
            throw new IllegalStateException("wg pubkey returned an unexpected value");
        }
        return new ClientKeys(privateKey, publicKey);
    }

    private ServerInfo serverInfo(RemoteHostSession session, PeerConfigStore store, Server server) {
        PeerRegistry registry = store.readOrEmpty();
        if (!fileExists(session, layout.serverPublicKeyPath())) {
            log.warn("Server {} has no public key file, generating server keys", server.id());
            ensureServerKeys(session, registry);
        }
        String publicKey = session.run("cat " + layout.serverPublicKeyPath()).strip();
        return new ServerInfo(publicKey, publicIp(session, server), registry.listenPort(layout.listenPort()));
    }

    private String publicIp(RemoteHostSession session, Server server) {
        String[] probes = {
                "curl -s --max-time 5 ifconfig.me || curl -s --max-time 5 api.ipify.org || curl -s --max-time 5 icanhazip.com",
                "hostname -I | awk '{print $1}'"
        };
        for (String probe : probes) {
            try {
                String ip = session.run(probe).strip();
                if (PUBLIC_IP.matcher(ip).matches()) return ip;
            } catch (CommandFailedException e) {
                log.debug("Public IP probe failed ({}): {}", probe, e.getMessage());
            }
        }
        return server.address();
    }

    private String clientConfig(ClientKeys keys, String address, ServerInfo info) {
        return "[Interface]\n"
                + "PrivateKey = " + keys.privateKey() + "\n"
                + "Address = " + address + "/32\n"
                + "DNS = " + layout.clientDns() + "\n"
                + "\n"
                + "[Peer]\n"
                + "PublicKey = " + info.publicKey() + "\n"
                + "AllowedIPs = 0.0.0.0/0\n"
                + "Endpoint = " + info.endpoint() + "\n"
                + "PersistentKeepalive = " + layout.persistentKeepalive() + "\n";
    }

    @Override
    public void removeClient(Server server, String clientName) {
        locks.withLock(server.id(), () -> {
            try (RemoteHostSession session = open(server)) {
                PeerConfigStore store = new PeerConfigStore(session, layout);
                boolean removed = stage(ProvisioningStage.REMOVE_PEER, () -> store.removePeer(clientName));
                if (removed) {
                    stageRun(ProvisioningStage.RESTART_SERVICE, () -> restart(session));
                    log.info("Client {} removed from server {}", clientName, server.id());
                } else {
                    log.info("Client {} not present on server {}, nothing to remove", clientName, server.id());
                }
            }
            artifacts.delete(clientName);
        });
    }

    @Override
    public void revokeClientConfig(Server server, String configPath) {
        removeClient(server, clientNameOf(configPath));
    }

    @Override
    public void blockClient(Server server, String configPath) {
        toggle(server, clientNameOf(configPath), true);
    }

    @Override
    public void unblockClient(Server server, String configPath) {
        toggle(server, clientNameOf(configPath), false);
    }

    private void toggle(Server server, String clientName, boolean blocked) {
        locks.withLock(server.id(), () -> {
            try (RemoteHostSession session = open(server)) {
                PeerConfigStore store = new PeerConfigStore(session, layout);
                boolean changed = stage(ProvisioningStage.TOGGLE_PEER, () -> store.setBlocked(clientName, blocked));
                if (changed) {
                    stageRun(ProvisioningStage.RESTART_SERVICE, () -> restart(session));
                }
                log.info("Client {} on server {} is now {}{}", clientName, server.id(),
                        blocked ? "blocked" : "unblocked", changed ? "" : " (unchanged)");
            }
        });
    }

    @Override
    public boolean isClientBlocked(Server server, String configPath) {
        String clientName = clientNameOf(configPath);
        return locks.withLock(server.id(), () -> {
            try (RemoteHostSession session = open(server)) {
                return new PeerConfigStore(session, layout).isBlocked(clientName);
            }
        });
    }

    @Override
    public ServerInspection inspectServer(Server server) {
        return locks.withLock(server.id(), () -> {
            try (RemoteHostSession session = open(server)) {
                boolean installed = commandSucceeds(session, "command -v wg");
                boolean registryPresent = fileExists(session, layout.registryPath());
                int peers = registryPresent ? new PeerConfigStore(session, layout).readOrEmpty().peerCount() : 0;
                return new ServerInspection(server.id(), installed, registryPresent, peers);
            }
        });
    }

    /* =========================
       Helpers
       ========================= */

    /**
     * Client name encoded in an artifact path: base name without ".conf".
     */
    static String clientNameOf(String configPath) {
        if (configPath == null || configPath.isBlank()) {
            throw new ProvisioningException(ProvisioningError.INVALID_CONFIG_PATH, "Config path is empty");
        }
        String s = configPath.strip();
        int slash = Math.max(s.lastIndexOf('/'), s.lastIndexOf('\\'));
        String base = s.substring(slash + 1);
        if (base.endsWith(".conf")) {
            base = base.substring(0, base.length() - ".conf".length());
        }
        if (!PeerRegistry.isValidClientName(base)) {
            throw new ProvisioningException(ProvisioningError.INVALID_CONFIG_PATH,
                    "Config path does not name a client: " + configPath);
        }
        return base;
    }

    private void restart(RemoteHostSession session) {
        session.run("systemctl restart " + layout.serviceUnit());
    }

    private static boolean fileExists(RemoteHostSession session, String path) {
        return "yes".equals(session.run("test -f " + path + " && echo yes || echo no").strip());
    }

    private static boolean commandSucceeds(RemoteHostSession session, String command) {
        try {
            session.run(command);
            return true;
        } catch (CommandFailedException e) {
            return false;
        }
    }

    private RemoteHostSession open(Server server) {
        return connector.connect(HostEndpoint.of(server), layout.connectTimeout());
    }

    /**
     * Connects on a helper thread and gives up after {@code timeout}. A session that arrives
     * after the deadline is closed as soon as it completes.
     */
    private RemoteHostSession connectWithin(Server server, Duration timeout) {
        CompletableFuture<RemoteHostSession> pending = CompletableFuture.supplyAsync(
                () -> connector.connect(HostEndpoint.of(server), layout.connectTimeout()), connectExecutor);
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.thenAccept(late -> {
                log.warn("Late SSH session to server {} closed after setup timeout", server.id());
                late.close();
            });
            throw new ProvisioningException(ProvisioningError.SETUP_TIMEOUT,
                    "Timed out connecting to " + server.address() + " after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.thenAccept(RemoteHostSession::close);
            throw new ProvisioningException(ProvisioningError.SETUP_TIMEOUT, "Interrupted while connecting to " + server.address(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new ProvisioningException(ProvisioningError.UNREACHABLE, "Connect to " + server.address() + " failed", cause);
        }
    }

    private static <T> T stage(ProvisioningStage stage, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            throw ProvisioningException.atStage(stage, e);
        }
    }

    private static void stageRun(ProvisioningStage stage, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            throw ProvisioningException.atStage(stage, e);
        }
    }

    @Override
    public void close() {
        connectExecutor.shutdownNow();
    }

    private record ClientKeys(String privateKey, String publicKey) {
    }
}
