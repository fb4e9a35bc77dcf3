package com.wgbot.application.lifecycle;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one reconciliation sweep.
 *
 * @param expiredIds    subscriptions moved to EXPIRED in this sweep
 * @param warned        near-expiry warnings delivered
 * @param updateFailures expired subscriptions whose status could not be stored (retried next sweep)
 * @param revokeFailures expired subscriptions whose remote config could not be revoked
 */
public record SweepReport(
        Instant at,
        int scanned,
        List<Long> expiredIds,
        int warned,
        int updateFailures,
        int revokeFailures,
        int notificationFailures,
        boolean loadFailed
) {
    public SweepReport {
        expiredIds = List.copyOf(expiredIds);
    }

    public static SweepReport loadFailed(Instant at) {
        return new SweepReport(at, 0, List.of(), 0, 0, 0, 0, true);
    }

    public int expired() {
        return expiredIds.size();
    }
}
