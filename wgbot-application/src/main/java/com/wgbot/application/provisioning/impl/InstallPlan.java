package com.wgbot.application.provisioning.impl;

import java.util.List;

/**
 * Commands that install WireGuard tools for one OS family.
 *
 * @param bestEffort       commands whose failure is only logged
 * @param steps            commands run in order
 * @param firstSuccessWins when true {@code steps} are alternatives and the first one that succeeds ends the plan
 */
public record InstallPlan(OsFamily family, List<String> bestEffort, List<String> steps, boolean firstSuccessWins) {

    public InstallPlan {
        bestEffort = List.copyOf(bestEffort);
        steps = List.copyOf(steps);
    }

    public static InstallPlan forFamily(OsFamily family) {
        return switch (family) {
            case DEBIAN -> new InstallPlan(family, List.of(), List.of(
                    "apt-get update",
                    "DEBIAN_FRONTEND=noninteractive apt-get install -y wireguard wireguard-tools"
            ), false);
            case RHEL -> new InstallPlan(family, List.of(
                    "yum install -y epel-release"
            ), List.of(
                    "yum install -y wireguard-tools"
            ), false);
            case ARCH -> new InstallPlan(family, List.of(), List.of(
                    "pacman -Sy --noconfirm wireguard-tools"
            ), false);
            case ALPINE -> new InstallPlan(family, List.of(), List.of(
                    "apk add --update wireguard-tools"
            ), false);
            case UNKNOWN -> new InstallPlan(family, List.of(), List.of(
                    "command -v apt-get && apt-get update && DEBIAN_FRONTEND=noninteractive apt-get install -y wireguard wireguard-tools",
                    "command -v yum && yum install -y wireguard-tools",
                    "command -v pacman && pacman -Sy --noconfirm wireguard-tools",
                    "command -v apk && apk add --update wireguard-tools"
            ), true);
        };
    }
}
