package com.wgbot.application.lifecycle;

import com.wgbot.application.ports.NotifierPort;
import com.wgbot.application.ports.ServerStorePort;
import com.wgbot.application.ports.SubscriptionStorePort;
import com.wgbot.application.provisioning.ProvisioningEngine;
import com.wgbot.domain.model.Server;
import com.wgbot.domain.model.Subscription;
import com.wgbot.domain.model.SubscriptionPlan;
import com.wgbot.domain.model.SubscriptionStatus;
import com.wgbot.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Brings stored subscriptions in line with their end dates.
 *
 * Per sweep:
 * - expired subscriptions are marked EXPIRED, their peer is revoked and the user is told
 * - subscriptions ending within {@code warningDays} get one warning
 * - admins receive one aggregated report when anything expired
 *
 * A failed status update skips the subscription entirely; it stays ACTIVE and is retried next sweep.
 */
public class SubscriptionReconciler {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionReconciler.class);

    public static final int DEFAULT_WARNING_DAYS = 3;

    private final SubscriptionStorePort subscriptions;
    private final ServerStorePort servers;
    private final ProvisioningEngine engine;
    private final NotifierPort notifier;
    private final SubscriptionMessages messages;
    private final int warningDays;

    public SubscriptionReconciler(
            SubscriptionStorePort subscriptions,
            ServerStorePort servers,
            ProvisioningEngine engine,
            NotifierPort notifier,
            SubscriptionMessages messages,
            int warningDays
    ) {
        this.subscriptions = subscriptions;
        this.servers = servers;
        this.engine = engine;
        this.notifier = notifier;
        this.messages = messages;
        this.warningDays = warningDays;
    }

    public SweepReport sweep(Instant now) {
        List<Subscription> active;
        try {
            active = subscriptions.getActiveSubscriptions();
        } catch (RuntimeException e) {
            log.error("Sweep aborted: failed to load active subscriptions", e);
            return SweepReport.loadFailed(now);
        }

        List<Subscription> expired = new ArrayList<>();
        int warned = 0;
        int updateFailures = 0;
        int revokeFailures = 0;
        int notificationFailures = 0;

        for (Subscription s : active) {
            if (s.status() != SubscriptionStatus.ACTIVE) continue;

            if (s.isExpiredAt(now)) {
                Subscription marked;
                try {
                    marked = s.withStatus(SubscriptionStatus.EXPIRED);
                    subscriptions.updateSubscription(marked);
                } catch (RuntimeException e) {
                    log.error("Failed to mark subscription {} expired, will retry next sweep", s.id(), e);
                    updateFailures++;
                    continue;
                }
                expired.add(marked);

                if (!revoke(marked)) revokeFailures++;
                if (!notifyUser(marked, messages.expired(marked, planName(marked)))) notificationFailures++;
                continue;
            }

            long daysLeft = s.daysLeft(now);
            if (daysLeft >= 0 && daysLeft <= warningDays) {
                if (notifyUser(s, messages.expiringSoon(s, planName(s), daysLeft))) {
                    warned++;
                } else {
                    notificationFailures++;
                }
            }
        }

        if (!expired.isEmpty()) {
            notificationFailures += reportToAdmins(expired);
        }

        SweepReport report = new SweepReport(now, active.size(), expired.stream().map(Subscription::id).toList(),
                warned, updateFailures, revokeFailures, notificationFailures, false);
        log.info("Sweep done: scanned={}, expired={}, warned={}, updateFailures={}, revokeFailures={}",
                report.scanned(), report.expired(), report.warned(), report.updateFailures(), report.revokeFailures());
        return report;
    }

    /**
     * Removes the peer of an expired subscription and gives its server slot back.
     * Failures are logged; the subscription stays EXPIRED.
     */
    private boolean revoke(Subscription s) {
        if (!s.hasConfig()) {
            log.warn("Subscription {} has no config path, nothing to revoke", s.id());
            return false;
        }
        try {
            Server server = servers.getServerById(s.serverId());
            engine.revokeClientConfig(server, s.configFilePath());
        } catch (RuntimeException e) {
            log.error("Failed to revoke config of expired subscription {} on server {}", s.id(), s.serverId(), e);
            return false;
        }
        try {
            servers.releaseSlot(s.serverId());
        } catch (RuntimeException e) {
            log.warn("Failed to release slot on server {} for subscription {}", s.serverId(), s.id(), e);
        }
        return true;
    }

    private boolean notifyUser(Subscription s, String text) {
        try {
            User user = subscriptions.getUserById(s.userId());
            notifier.notify(user.telegramId(), text);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to notify user {} about subscription {}: {}", s.userId(), s.id(), e.getMessage());
            return false;
        }
    }

    /**
     * @return number of admins the report could not be delivered to
     */
    private int reportToAdmins(List<Subscription> expired) {
        List<User> admins;
        try {
            admins = subscriptions.getAllAdmins();
        } catch (RuntimeException e) {
            log.error("Failed to load admins for expiry report", e);
            return 1;
        }
        if (admins.isEmpty()) {
            log.info("No admins to send the expiry report to");
            return 0;
        }

        List<String> lines = new ArrayList<>();
        for (Subscription s : expired) {
            try {
                User user = subscriptions.getUserById(s.userId());
                SubscriptionPlan plan = subscriptions.getSubscriptionPlanById(s.planId());
                lines.add(messages.reportLine(lines.size() + 1, s, user, plan.name()));
            } catch (RuntimeException e) {
                log.warn("Skipping subscription {} in expiry report: {}", s.id(), e.getMessage());
            }
        }
        String text = messages.expiredReport(expired.size(), lines);

        int failures = 0;
        for (User admin : admins) {
            try {
                notifier.notify(admin.telegramId(), text);
            } catch (RuntimeException e) {
                log.warn("Failed to send expiry report to admin {}: {}", admin.telegramId(), e.getMessage());
                failures++;
            }
        }
        return failures;
    }

    private String planName(Subscription s) {
        try {
            return subscriptions.getSubscriptionPlanById(s.planId()).name();
        } catch (RuntimeException e) {
            return "#" + s.planId();
        }
    }
}
