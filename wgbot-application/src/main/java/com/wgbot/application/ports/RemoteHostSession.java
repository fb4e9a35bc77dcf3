package com.wgbot.application.ports;

/**
 * An open command channel to one host. Calls are serialized: one command at a time.
 */
public interface RemoteHostSession extends AutoCloseable {

    /**
     * Runs a shell command and returns its standard output.
     *
     * @throws com.wgbot.application.provisioning.CommandFailedException on non-zero exit,
     *         carrying the captured standard error
     */
    String run(String command);

    /**
     * Replaces the file at {@code path} with {@code content}.
     */
    void writeFile(String path, String content);

    /** Idempotent. */
    @Override
    void close();
}
