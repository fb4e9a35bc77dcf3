package com.wgbot.api.common;

import com.wgbot.application.ports.RecordNotFoundException;
import com.wgbot.application.provisioning.CommandFailedException;
import com.wgbot.application.provisioning.ProvisioningError;
import com.wgbot.application.provisioning.ProvisioningException;
import com.wgbot.application.provisioning.ProvisioningStage;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void provisioningErrorsMapToGatewayStatuses() {
    assertThat(ApiExceptionHandler.statusFor(ProvisioningError.SETUP_TIMEOUT)).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
    assertThat(ApiExceptionHandler.statusFor(ProvisioningError.NO_CAPACITY)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(ApiExceptionHandler.statusFor(ProvisioningError.UNREACHABLE)).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(ApiExceptionHandler.statusFor(ProvisioningError.AUTH_FAILED)).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(ApiExceptionHandler.statusFor(ProvisioningError.INVALID_CONFIG_PATH)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
  }

  @Test
  void stagedFailureKeepsCauseAndStage() {
    ProvisioningException staged = ProvisioningException.atStage(ProvisioningStage.APPEND_PEER,
        new CommandFailedException("mv -f", 1, "mv: cannot move: Read-only file system"));

    var response = handler.provisioning(staged);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(response.getBody())
        .containsEntry("reason", "provisioning_failed:append_peer")
        .containsEntry("stage", "append_peer");
    assertThat((String) response.getBody().get("message")).contains("Read-only file system");
  }

  @Test
  void notFoundIs404() {
    var response = handler.notFound(new RecordNotFoundException("Subscription", 42));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody()).containsEntry("message", "Subscription not found: 42");
  }
}
