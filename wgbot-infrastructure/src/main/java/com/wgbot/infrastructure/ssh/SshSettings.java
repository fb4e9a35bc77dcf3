package com.wgbot.infrastructure.ssh;

import java.time.Duration;

/**
 * Client-side SSH options.
 *
 * @param strictHostKeyChecking "yes", "no" or "accept-new"
 * @param knownHostsFile        optional known_hosts path, used when host keys are checked
 * @param channelTimeout        upper bound for opening one exec channel
 */
public record SshSettings(String strictHostKeyChecking, String knownHostsFile, Duration channelTimeout) {

    public SshSettings {
        if (strictHostKeyChecking == null || strictHostKeyChecking.isBlank()) strictHostKeyChecking = "no";
        if (channelTimeout == null) channelTimeout = Duration.ofSeconds(30);
    }

    public static SshSettings defaults() {
        return new SshSettings("no", null, Duration.ofSeconds(30));
    }
}
