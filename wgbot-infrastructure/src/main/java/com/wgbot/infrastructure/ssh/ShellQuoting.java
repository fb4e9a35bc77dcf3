package com.wgbot.infrastructure.ssh;

/**
 * POSIX shell single-quoting.
 */
public final class ShellQuoting {

    private ShellQuoting() {}

    public static String quote(String s) {
        if (s == null) return "''";
        return "'" + s.replace("'", "'\\''") + "'";
    }

    /**
     * Runs {@code command} through a non-interactive sudo so every shell operator inside it is privileged.
     */
    public static String sudo(String command) {
        return "sudo -n sh -c " + quote(command);
    }
}
