package com.wgbot.application.provisioning.impl;

import com.wgbot.application.provisioning.ProvisioningError;
import com.wgbot.application.provisioning.ProvisioningException;
import com.wgbot.application.provisioning.ProvisioningStage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable text model of a WireGuard interface config used as the peer registry.
 *
 * Peer block layout:
 * <pre>
 * # name            #BLOCKED name
 * [Peer]            #[Peer]
 * PublicKey = k     #PublicKey = k
 * AllowedIPs = a    #AllowedIPs = a
 * </pre>
 * Rendering an unmodified registry reproduces the source text byte-for-byte.
 */
public final class PeerRegistry {

    private static final String ACTIVE_MARKER = "# ";
    private static final String BLOCKED_MARKER = "#BLOCKED ";
    private static final Pattern BODY_KEY = Pattern.compile(
            "^(PublicKey|AllowedIPs|PresharedKey|Endpoint|PersistentKeepalive)\\s*=.*");
    private static final Pattern CLIENT_NAME = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final Pattern WG_KEY = Pattern.compile("[A-Za-z0-9+/]{42,43}=?");

    private static final int FIRST_CLIENT_OCTET = 2;
    private static final int LAST_CLIENT_OCTET = 254;

    private final List<String> lines;

    private PeerRegistry(List<String> lines) {
        this.lines = Collections.unmodifiableList(lines);
    }

    public static PeerRegistry parse(String text) {
        Objects.requireNonNull(text, "text");
        return new PeerRegistry(List.of(text.split("\n", -1)));
    }

    public static PeerRegistry empty() {
        return parse("");
    }

    public static boolean isValidClientName(String name) {
        return name != null && CLIENT_NAME.matcher(name).matches();
    }

    public static boolean isValidKey(String key) {
        return key != null && WG_KEY.matcher(key).matches();
    }

    public String render() {
        return String.join("\n", lines);
    }

    /* =========================
       Queries
       ========================= */

    public boolean contains(String name) {
        return !markerIndexes(name).isEmpty();
    }

    public boolean isBlocked(String name) {
        for (int i : markerIndexes(name)) {
            if (isBlockedMarker(lines.get(i), name)) return true;
        }
        return false;
    }

    /**
     * Peer sections, active or commented out. Blocked peers keep their address.
     */
    public int peerCount() {
        int count = 0;
        for (String line : lines) {
            String s = line.strip();
            if (s.equals("[Peer]") || s.equals("#[Peer]")) count++;
        }
        return count;
    }

    public boolean hasInterfaceSection() {
        for (String line : lines) {
            if (line.strip().equals("[Interface]")) return true;
        }
        return false;
    }

    public int listenPort(int defaultPort) {
        return interfaceValue("ListenPort").map(v -> {
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                return defaultPort;
            }
        }).orElse(defaultPort);
    }

    public Optional<String> privateKey() {
        return interfaceValue("PrivateKey").filter(PeerRegistry::isValidKey);
    }

    /**
     * Next client address in {@code subnetPrefix}.0/24: one past the highest last octet in use,
     * counting commented-out AllowedIPs lines. {@code .1} belongs to the server.
     */
    public String nextFreeAddress(String subnetPrefix) {
        int highest = FIRST_CLIENT_OCTET - 1;
        String prefix = subnetPrefix + ".";
        for (String line : lines) {
            String s = uncomment(line.strip());
            if (!s.startsWith("AllowedIPs")) continue;
            int eq = s.indexOf('=');
            if (eq < 0) continue;
            for (String entry : s.substring(eq + 1).split(",")) {
                String ip = entry.strip();
                int slash = ip.indexOf('/');
                if (slash >= 0) ip = ip.substring(0, slash);
                if (!ip.startsWith(prefix)) continue;
                try {
                    highest = Math.max(highest, Integer.parseInt(ip.substring(prefix.length())));
                } catch (NumberFormatException ignored) {
                    // not an IPv4 host inside the pool
                }
            }
        }
        int next = highest + 1;
        if (next > LAST_CLIENT_OCTET) {
            throw new ProvisioningException(ProvisioningError.PROVISIONING_FAILED, ProvisioningStage.ALLOCATE_ADDRESS,
                    "Address pool " + subnetPrefix + ".0/24 is exhausted", null);
        }
        return prefix + next;
    }

    /* =========================
       Mutations (return a new registry)
       ========================= */

    public PeerRegistry append(String name, String publicKey, String allowedIps) {
        String text = render();
        StringBuilder sb = new StringBuilder(text);
        if (!text.isEmpty() && !text.endsWith("\n")) sb.append('\n');
        sb.append('\n')
                .append(ACTIVE_MARKER).append(name).append('\n')
                .append("[Peer]\n")
                .append("PublicKey = ").append(publicKey).append('\n')
                .append("AllowedIPs = ").append(allowedIps).append('\n');
        return parse(sb.toString());
    }

    /**
     * Puts {@code section} in front of the existing text, separated by a blank line.
     */
    public PeerRegistry withInterfaceSection(String section) {
        String text = render();
        if (text.isBlank()) return parse(section);
        return parse(section + (section.endsWith("\n") ? "" : "\n") + "\n" + text);
    }

    /**
     * Drops every block named exactly {@code name} plus the blank separator line before it.
     * Returns this instance when nothing matched.
     */
    public PeerRegistry remove(String name) {
        List<Integer> markers = markerIndexes(name);
        if (markers.isEmpty()) return this;

        boolean[] drop = new boolean[lines.size()];
        for (int marker : markers) {
            drop[marker] = true;
            int end = bodyEnd(marker + 1);
            for (int i = marker + 1; i < end; i++) drop[i] = true;
            if (marker > 0 && lines.get(marker - 1).isBlank()) drop[marker - 1] = true;
        }
        List<String> kept = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            if (!drop[i]) kept.add(lines.get(i));
        }
        if (kept.isEmpty()) kept.add("");
        return new PeerRegistry(kept);
    }

    /**
     * Comments out (or restores) exactly the blocks named {@code name}.
     * A block already in the requested state is left untouched.
     */
    public PeerRegistry setBlocked(String name, boolean blocked) {
        List<Integer> markers = markerIndexes(name);
        if (markers.isEmpty()) return this;

        List<String> out = new ArrayList<>(lines);
        boolean changed = false;
        for (int marker : markers) {
            String markerLine = out.get(marker);
            boolean isBlocked = isBlockedMarker(markerLine, name);
            if (isBlocked == blocked) continue;

            if (blocked) {
                out.set(marker, markerLine.replace(ACTIVE_MARKER + name, BLOCKED_MARKER + name));
            } else {
                out.set(marker, markerLine.replace(BLOCKED_MARKER + name, ACTIVE_MARKER + name));
            }
            int end = bodyEnd(marker + 1);
            for (int i = marker + 1; i < end; i++) {
                String line = out.get(i);
                if (blocked && !line.startsWith("#")) {
                    out.set(i, "#" + line);
                } else if (!blocked && line.startsWith("#")) {
                    out.set(i, line.substring(1));
                }
            }
            changed = true;
        }
        return changed ? new PeerRegistry(out) : this;
    }

    /* =========================
       Internals
       ========================= */

    private List<Integer> markerIndexes(String name) {
        List<Integer> out = new ArrayList<>();
        if (name == null || name.isBlank()) return out;
        for (int i = 0; i < lines.size(); i++) {
            String s = lines.get(i).strip();
            boolean marker = s.equals(ACTIVE_MARKER + name) || s.equals(BLOCKED_MARKER + name);
            if (marker && startsPeerBody(i + 1)) out.add(i);
        }
        return out;
    }

    private static boolean isBlockedMarker(String line, String name) {
        return line.strip().equals(BLOCKED_MARKER + name);
    }

    private boolean startsPeerBody(int index) {
        return index < lines.size() && uncomment(lines.get(index).strip()).equals("[Peer]");
    }

    private int bodyEnd(int start) {
        int i = start;
        boolean first = true;
        while (i < lines.size()) {
            String s = uncomment(lines.get(i).strip());
            boolean body = first ? s.equals("[Peer]") : BODY_KEY.matcher(s).matches();
            if (!body) break;
            first = false;
            i++;
        }
        return i;
    }

    private Optional<String> interfaceValue(String key) {
        boolean inInterface = false;
        for (String line : lines) {
            String s = line.strip();
            if (s.startsWith("[")) {
                inInterface = s.equals("[Interface]");
                continue;
            }
            if (s.startsWith("#[")) {
                inInterface = false;
                continue;
            }
            if (!inInterface || s.startsWith("#")) continue;
            int eq = s.indexOf('=');
            if (eq < 0) continue;
            if (s.substring(0, eq).strip().equals(key)) {
                return Optional.of(s.substring(eq + 1).strip());
            }
        }
        return Optional.empty();
    }

    /**
     * Strips one leading '#' and the whitespace behind it, so indented lines commented out by
     * {@link #setBlocked} still match.
     */
    private static String uncomment(String s) {
        return s.startsWith("#") ? s.substring(1).strip() : s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeerRegistry other)) return false;
        return lines.equals(other.lines);
    }

    @Override
    public int hashCode() {
        return lines.hashCode();
    }

    @Override
    public String toString() {
        return "PeerRegistry[peers=" + peerCount() + "]";
    }
}
