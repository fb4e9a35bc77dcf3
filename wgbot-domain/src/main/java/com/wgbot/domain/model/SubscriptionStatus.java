package com.wgbot.domain.model;

import java.util.Locale;

/**
 * Lifecycle status of a subscription.
 *
 * Allowed transitions:
 * - ACTIVE  -> EXPIRED | REVOKED | BLOCKED
 * - BLOCKED -> ACTIVE | REVOKED
 * EXPIRED and REVOKED are terminal.
 */
public enum SubscriptionStatus {
    ACTIVE,
    EXPIRED,
    BLOCKED,
    REVOKED;

    public boolean canTransitionTo(SubscriptionStatus next) {
        if (next == null) return false;
        return switch (this) {
            case ACTIVE -> next == EXPIRED || next == REVOKED || next == BLOCKED;
            case BLOCKED -> next == ACTIVE || next == REVOKED;
            case EXPIRED, REVOKED -> false;
        };
    }

    public boolean isTerminal() {
        return this == EXPIRED || this == REVOKED;
    }

    /** Storage code, e.g. "active". */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SubscriptionStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Subscription status is empty");
        }
        return SubscriptionStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
