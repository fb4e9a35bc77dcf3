package com.wgbot.application.provisioning;

/**
 * A remote command exited non-zero.
 */
public final class CommandFailedException extends ProvisioningException {

    private final String command;
    private final int exitCode;
    private final String stderr;

    public CommandFailedException(String command, int exitCode, String stderr) {
        super(ProvisioningError.COMMAND_FAILED, "command execution failed (exit " + exitCode + "): " + summary(stderr));
        this.command = command;
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public String command() {
        return command;
    }

    public int exitCode() {
        return exitCode;
    }

    public String stderr() {
        return stderr;
    }

    private static String summary(String stderr) {
        if (stderr == null || stderr.isBlank()) return "<no stderr>";
        String s = stderr.strip();
        return s.length() > 500 ? s.substring(0, 500) + "..." : s;
    }
}
