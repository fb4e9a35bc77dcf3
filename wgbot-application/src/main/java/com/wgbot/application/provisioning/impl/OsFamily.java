package com.wgbot.application.provisioning.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Package-manager family of a Linux host, derived from /etc/os-release.
 */
public enum OsFamily {
    DEBIAN("debian", "ubuntu", "linuxmint", "raspbian", "pop", "kali"),
    RHEL("rhel", "centos", "fedora", "rocky", "almalinux", "ol", "amzn"),
    ARCH("arch", "manjaro", "endeavouros"),
    ALPINE("alpine"),
    UNKNOWN;

    private final List<String> ids;

    OsFamily(String... ids) {
        this.ids = List.of(ids);
    }

    /**
     * Classifies by ID first, then by each ID_LIKE entry in order.
     */
    public static OsFamily classify(String osRelease) {
        if (osRelease == null || osRelease.isBlank()) return UNKNOWN;

        List<String> candidates = new ArrayList<>();
        String idLike = null;
        for (String raw : osRelease.split("\n")) {
            String line = raw.strip();
            if (line.startsWith("ID=")) {
                candidates.add(0, unquote(line.substring(3)));
            } else if (line.startsWith("ID_LIKE=")) {
                idLike = unquote(line.substring(8));
            }
        }
        if (idLike != null) {
            for (String token : idLike.split("\\s+")) {
                if (!token.isBlank()) candidates.add(token);
            }
        }

        for (String candidate : candidates) {
            for (OsFamily family : values()) {
                if (family.ids.contains(candidate)) return family;
            }
        }
        return UNKNOWN;
    }

    private static String unquote(String v) {
        String s = v.strip();
        if (s.length() >= 2 && (s.startsWith("\"") || s.startsWith("'"))) {
            s = s.substring(1, s.length() - 1);
        }
        return s.toLowerCase(Locale.ROOT);
    }
}
