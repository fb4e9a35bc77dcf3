package com.wgbot.infrastructure.ssh;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.wgbot.application.ports.RemoteHostSession;
import com.wgbot.application.provisioning.CommandFailedException;
import com.wgbot.application.provisioning.ProvisioningError;
import com.wgbot.application.provisioning.ProvisioningException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * One JSch session; every command runs on its own exec channel. Calls are serialized.
 */
public class JschRemoteHostSession implements RemoteHostSession {

    private static final long CLOSE_POLL_MS = 20;

    private final Session session;
    private final boolean useSudo;
    private final Duration channelTimeout;
    private boolean closed;

    JschRemoteHostSession(Session session, boolean useSudo, Duration channelTimeout) {
        this.session = session;
        this.useSudo = useSudo;
        this.channelTimeout = channelTimeout;
    }

    @Override
    public synchronized String run(String command) {
        return exec(useSudo ? ShellQuoting.sudo(command) : command, command, null);
    }

    @Override
    public synchronized void writeFile(String path, String content) {
        String command = "cat > " + ShellQuoting.quote(path);
        exec(useSudo ? ShellQuoting.sudo(command) : command, command, content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Runs without the sudo wrapper; used for the privilege probe itself.
     */
    synchronized String runRaw(String command) {
        return exec(command, command, null);
    }

    private String exec(String wireCommand, String displayCommand, byte[] stdin) {
        if (closed) {
            throw new IllegalStateException("SSH session already closed");
        }
        ChannelExec channel = null;
        try {
            channel = (ChannelExec) session.openChannel("exec");
            channel.setCommand(wireCommand);
            ByteArrayOutputStream stderr = new ByteArrayOutputStream();
            channel.setErrStream(stderr, true);
            if (stdin == null) channel.setInputStream(null);
            OutputStream in = stdin == null ? null : channel.getOutputStream();
            InputStream out = channel.getInputStream();

            channel.connect(Math.toIntExact(channelTimeout.toMillis()));
            if (in != null) {
                in.write(stdin);
                in.flush();
                in.close();
            }

            String stdout = new String(out.readAllBytes(), StandardCharsets.UTF_8);
            while (!channel.isClosed()) {
                Thread.sleep(CLOSE_POLL_MS);
            }
            int exit = channel.getExitStatus();
            if (exit != 0) {
                throw new CommandFailedException(displayCommand, exit, stderr.toString(StandardCharsets.UTF_8));
            }
            return stdout;
        } catch (JSchException e) {
            throw new ProvisioningException(ProvisioningError.UNREACHABLE,
                    "SSH channel failed for '" + displayCommand + "': " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ProvisioningException(ProvisioningError.UNREACHABLE,
                    "SSH I/O failed for '" + displayCommand + "': " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisioningException(ProvisioningError.COMMAND_FAILED, "Interrupted while running '" + displayCommand + "'", e);
        } finally {
            if (channel != null) channel.disconnect();
        }
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        session.disconnect();
    }
}
