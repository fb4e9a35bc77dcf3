package com.wgbot.application.service;

import com.wgbot.domain.model.SubscriptionStatus;

/**
 * What an admin action did, including partial outcomes (e.g. revoked in storage but not on the host).
 */
public record AdminActionResult(
        Action action,
        long subscriptionId,
        Outcome outcome,
        SubscriptionStatus status,
        String message
) {
    public enum Action {
        BLOCK,
        UNBLOCK,
        REVOKE
    }

    public enum Outcome {
        COMPLETED,
        FAILED,
        TIMED_OUT
    }

    public boolean completed() {
        return outcome == Outcome.COMPLETED;
    }
}
