package com.wgbot.application.support;

import com.wgbot.application.ports.HostEndpoint;
import com.wgbot.application.ports.RemoteHostConnector;
import com.wgbot.application.ports.RemoteHostSession;
import com.wgbot.application.provisioning.CommandFailedException;
import com.wgbot.application.provisioning.ProvisioningException;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory Linux host that understands the exact commands the provisioning engine issues.
 */
public class FakeRemoteHost implements RemoteHostConnector {

    private static final Pattern TEST_FILE = Pattern.compile("test -f (\\S+) && echo yes \\|\\| echo no");
    private static final Pattern SERVER_KEYGEN = Pattern.compile("umask 077 && wg genkey \\| tee (\\S+) \\| wg pubkey > (\\S+)");
    private static final Pattern WRITE_KEY = Pattern.compile("umask 077 && echo '([^']+)' > (\\S+)");
    private static final Pattern DERIVE_KEY_FILE = Pattern.compile("wg pubkey < (\\S+) > (\\S+)");
    private static final Pattern DERIVE_KEY = Pattern.compile("echo '([^']+)' \\| wg pubkey");
    private static final Pattern MOVE = Pattern.compile("chmod 600 (\\S+) && mv -f (\\S+) (\\S+)");

    public final Map<String, String> files = new HashMap<>();
    public final List<String> commands = new ArrayList<>();
    public final Set<String> packageManagers = new HashSet<>(Set.of("apt-get"));

    public String osRelease = "ID=ubuntu\nID_LIKE=debian\n";
    public boolean wgInstalled = true;
    public boolean interfaceUp = false;
    public boolean installWorks = true;
    public String publicIp = "203.0.113.10";

    public final AtomicInteger connects = new AtomicInteger();
    public final AtomicInteger closes = new AtomicInteger();
    public final AtomicInteger serverKeyGenerations = new AtomicInteger();
    public final AtomicInteger restarts = new AtomicInteger();
    private final AtomicInteger keySeq = new AtomicInteger();

    private RuntimeException connectFailure;
    private CountDownLatch connectGate;
    private final List<String> failingPrefixes = new ArrayList<>();

    public void failConnectWith(ProvisioningException e) {
        this.connectFailure = e;
    }

    /**
     * Blocks every connect until the latch is released.
     */
    public void holdConnects(CountDownLatch gate) {
        this.connectGate = gate;
    }

    public synchronized void failCommandsStartingWith(String prefix) {
        failingPrefixes.add(prefix);
    }

    public synchronized int count(String prefix) {
        return (int) commands.stream().filter(c -> c.startsWith(prefix)).count();
    }

    public synchronized String registry() {
        return files.get("/etc/wireguard/wg0.conf");
    }

    /**
     * A host where setup already ran: keys and an interface section exist, interface up.
     */
    public synchronized FakeRemoteHost configured() {
        String priv = newKey();
        files.put("/etc/wireguard/server_private.key", priv + "\n");
        files.put("/etc/wireguard/server_public.key", derive(priv) + "\n");
        files.put("/etc/wireguard/wg0.conf", "[Interface]\nPrivateKey = " + priv
                + "\nAddress = 10.0.0.1/24\nListenPort = 51820\n");
        interfaceUp = true;
        return this;
    }

    @Override
    public RemoteHostSession connect(HostEndpoint endpoint, Duration timeout) {
        CountDownLatch gate = connectGate;
        if (gate != null) {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (connectFailure != null) throw connectFailure;
        connects.incrementAndGet();
        return new Session();
    }

    private synchronized String execute(String cmd) {
        commands.add(cmd);
        for (String prefix : failingPrefixes) {
            if (cmd.startsWith(prefix)) throw new CommandFailedException(cmd, 1, "injected failure");
        }

        Matcher m;
        if (cmd.equals("command -v wg")) {
            if (wgInstalled) return "/usr/bin/wg\n";
            throw new CommandFailedException(cmd, 1, "");
        }
        if (cmd.equals("cat /etc/os-release")) {
            if (osRelease == null) throw new CommandFailedException(cmd, 1, "No such file or directory");
            return osRelease;
        }
        if (cmd.startsWith("command -v ") && cmd.contains(" && ")) {
            String manager = cmd.substring("command -v ".length(), cmd.indexOf(" && "));
            if (!packageManagers.contains(manager)) throw new CommandFailedException(cmd, 1, "");
            return install(cmd);
        }
        if (cmd.contains("apt-get") || cmd.startsWith("yum ") || cmd.startsWith("pacman ") || cmd.startsWith("apk ")) {
            return install(cmd);
        }
        if (cmd.startsWith("mkdir -p ")) return "";
        if ((m = TEST_FILE.matcher(cmd)).matches()) {
            return files.containsKey(m.group(1)) ? "yes\n" : "no\n";
        }
        if ((m = SERVER_KEYGEN.matcher(cmd)).matches()) {
            serverKeyGenerations.incrementAndGet();
            String priv = newKey();
            files.put(m.group(1), priv + "\n");
            files.put(m.group(2), derive(priv) + "\n");
            return "";
        }
        if ((m = WRITE_KEY.matcher(cmd)).matches()) {
            files.put(m.group(2), m.group(1) + "\n");
            return "";
        }
        if ((m = DERIVE_KEY_FILE.matcher(cmd)).matches()) {
            files.put(m.group(2), derive(files.get(m.group(1)).strip()) + "\n");
            return "";
        }
        if ((m = DERIVE_KEY.matcher(cmd)).matches()) {
            return derive(m.group(1)) + "\n";
        }
        if (cmd.equals("wg genkey")) return newKey() + "\n";
        if (cmd.startsWith("cat ")) {
            String content = files.get(cmd.substring(4));
            if (content == null) throw new CommandFailedException(cmd, 1, "cat: " + cmd.substring(4) + ": No such file or directory");
            return content;
        }
        if ((m = MOVE.matcher(cmd)).matches()) {
            String content = files.remove(m.group(2));
            if (content == null) throw new CommandFailedException(cmd, 1, "mv: cannot stat");
            files.put(m.group(3), content);
            return "";
        }
        if (cmd.startsWith("ip -o -4 route")) return "ens3\n";
        if (cmd.startsWith("echo 'net.ipv4.ip_forward=1'")) return "";
        if (cmd.startsWith("systemctl enable ")) {
            interfaceUp = true;
            return "";
        }
        if (cmd.startsWith("systemctl restart ")) {
            restarts.incrementAndGet();
            return "";
        }
        if (cmd.startsWith("ip link show ")) {
            if (interfaceUp) return "4: wg0: <POINTOPOINT,NOARP,UP,LOWER_UP>\n";
            throw new CommandFailedException(cmd, 1, "Device \"wg0\" does not exist.");
        }
        if (cmd.startsWith("curl ")) return publicIp + "\n";
        if (cmd.startsWith("hostname -I")) return "10.1.1.1\n";
        throw new IllegalStateException("Unexpected command: " + cmd);
    }

    private String install(String cmd) {
        if (!installWorks) throw new CommandFailedException(cmd, 100, "E: Unable to locate package");
        wgInstalled = true;
        return "";
    }

    private synchronized void write(String path, String content) {
        commands.add("write " + path);
        files.put(path, content);
    }

    private String newKey() {
        byte[] raw = ByteBuffer.allocate(32).putInt(keySeq.incrementAndGet()).putLong(0x5eed_f00dL).array();
        return Base64.getEncoder().encodeToString(raw);
    }

    private static String derive(String privateKey) {
        byte[] raw = Base64.getDecoder().decode(privateKey);
        byte[] pub = new byte[raw.length];
        for (int i = 0; i < raw.length; i++) pub[i] = (byte) (raw[raw.length - 1 - i] ^ 0x5a);
        return Base64.getEncoder().encodeToString(pub);
    }

    private final class Session implements RemoteHostSession {
        private boolean closed;

        @Override
        public String run(String command) {
            if (closed) throw new IllegalStateException("session closed");
            return execute(command);
        }

        @Override
        public void writeFile(String path, String content) {
            if (closed) throw new IllegalStateException("session closed");
            write(path, content);
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                closes.incrementAndGet();
            }
        }
    }
}
