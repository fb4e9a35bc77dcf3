package com.wgbot.application.provisioning;

import com.wgbot.domain.DomainException;

import java.util.Locale;
import java.util.Objects;

public class ProvisioningException extends DomainException {

    private final ProvisioningError error;
    private final ProvisioningStage stage;

    public ProvisioningException(ProvisioningError error, String message) {
        this(error, null, message, null);
    }

    public ProvisioningException(ProvisioningError error, String message, Throwable cause) {
        this(error, null, message, cause);
    }

    public ProvisioningException(ProvisioningError error, ProvisioningStage stage, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
        this.stage = stage;
    }

    /**
     * Wraps a failure inside {@code stage}. Transport errors and already-staged failures pass through unchanged.
     */
    public static ProvisioningException atStage(ProvisioningStage stage, RuntimeException cause) {
        if (cause instanceof ProvisioningException pe) {
            if (pe.error().isTransport() || pe.stage() != null || pe.error() != ProvisioningError.COMMAND_FAILED) {
                return pe;
            }
        }
        return new ProvisioningException(
                ProvisioningError.PROVISIONING_FAILED,
                stage,
                "Provisioning failed at " + stage + ": " + cause.getMessage(),
                cause
        );
    }

    public ProvisioningError error() {
        return error;
    }

    public ProvisioningStage stage() {
        return stage;
    }

    /**
     * Stable reason for API responses, e.g. "provisioning_failed:append_peer".
     */
    public String reason() {
        String base = error.name().toLowerCase(Locale.ROOT);
        return stage == null ? base : base + ":" + stage.name().toLowerCase(Locale.ROOT);
    }
}
