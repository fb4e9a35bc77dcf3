package com.wgbot.infrastructure.ssh;

import com.jcraft.jsch.JSchException;
import com.wgbot.application.ports.HostEndpoint;
import com.wgbot.application.provisioning.ProvisioningError;
import com.wgbot.application.provisioning.ProvisioningException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JschRemoteHostConnectorTest {

    private final HostEndpoint endpoint = new HostEndpoint("127.0.0.1", 22, "root", "secret");

    @Test
    void authenticationFailureIsClassifiedAsAuthFailed() {
        ProvisioningException e = JschRemoteHostConnector.classify(endpoint, new JSchException("Auth fail"));

        assertThat(e.error()).isEqualTo(ProvisioningError.AUTH_FAILED);
        assertThat(e.getMessage()).doesNotContain("secret");
    }

    @Test
    void otherSessionFailuresAreUnreachable() {
        ProvisioningException e = JschRemoteHostConnector.classify(endpoint,
                new JSchException("timeout: socket is not established"));

        assertThat(e.error()).isEqualTo(ProvisioningError.UNREACHABLE);
        assertThat(e.error().isTransport()).isTrue();
    }

    @Test
    void closedPortIsUnreachable() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        JschRemoteHostConnector connector = new JschRemoteHostConnector(SshSettings.defaults());

        assertThatThrownBy(() -> connector.connect(new HostEndpoint("127.0.0.1", port, "root", "pw"), Duration.ofSeconds(2)))
                .isInstanceOf(ProvisioningException.class)
                .extracting(t -> ((ProvisioningException) t).error())
                .isEqualTo(ProvisioningError.UNREACHABLE);
    }

    @Test
    void settingsFillDefaults() {
        SshSettings settings = new SshSettings(null, null, null);

        assertThat(settings.strictHostKeyChecking()).isEqualTo("no");
        assertThat(settings.channelTimeout()).isEqualTo(Duration.ofSeconds(30));
    }
}
