package com.wgbot.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A paid access window {@code [startDate, endDate)} bound to one server and one client config.
 */
public record Subscription(
        long id,
        long userId,
        long serverId,
        long planId,
        Instant startDate,
        Instant endDate,
        SubscriptionStatus status,
        String configFilePath,
        long dataUsage,
        Instant lastConnectionAt
) {
    public Subscription {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        Objects.requireNonNull(status, "status");
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate is before startDate");
        }
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(endDate);
    }

    /**
     * Whole days left until the end date, truncated toward zero.
     */
    public long daysLeft(Instant now) {
        return Duration.between(now, endDate).toDays();
    }

    public boolean hasConfig() {
        return configFilePath != null && !configFilePath.isBlank();
    }

    public Subscription withStatus(SubscriptionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal subscription transition " + status + " -> " + next + " (id=" + id + ")");
        }
        return new Subscription(id, userId, serverId, planId, startDate, endDate, next, configFilePath, dataUsage, lastConnectionAt);
    }
}
