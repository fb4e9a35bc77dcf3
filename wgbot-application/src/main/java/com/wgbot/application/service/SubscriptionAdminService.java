package com.wgbot.application.service;

import com.wgbot.application.lifecycle.SubscriptionMessages;
import com.wgbot.application.ports.NotifierPort;
import com.wgbot.application.ports.ServerStorePort;
import com.wgbot.application.ports.SubscriptionStorePort;
import com.wgbot.application.provisioning.ProvisioningEngine;
import com.wgbot.application.service.AdminActionResult.Action;
import com.wgbot.application.service.AdminActionResult.Outcome;
import com.wgbot.domain.model.Server;
import com.wgbot.domain.model.Subscription;
import com.wgbot.domain.model.SubscriptionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Admin-initiated block / unblock / revoke of a subscription.
 *
 * Each remote operation is awaited for at most {@code actionTimeout}. A timed-out operation keeps
 * running in the background and its late outcome is logged; the result says so explicitly.
 * Revoke marks the subscription REVOKED whatever the remote outcome.
 */
public class SubscriptionAdminService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionAdminService.class);

    private final SubscriptionStorePort subscriptions;
    private final ServerStorePort servers;
    private final ProvisioningEngine engine;
    private final NotifierPort notifier;
    private final SubscriptionMessages messages;
    private final Duration actionTimeout;
    private final ExecutorService executor;

    public SubscriptionAdminService(
            SubscriptionStorePort subscriptions,
            ServerStorePort servers,
            ProvisioningEngine engine,
            NotifierPort notifier,
            SubscriptionMessages messages,
            Duration actionTimeout
    ) {
        this.subscriptions = subscriptions;
        this.servers = servers;
        this.engine = engine;
        this.notifier = notifier;
        this.messages = messages;
        this.actionTimeout = actionTimeout;
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "wgbot-admin-action-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public AdminActionResult block(long subscriptionId) {
        Subscription s = subscriptions.getSubscriptionById(subscriptionId);
        requireStatus(s, Action.BLOCK, SubscriptionStatus.ACTIVE);
        Server server = servers.getServerById(s.serverId());

        AdminActionResult result = await(Action.BLOCK, s, () -> engine.blockClient(server, s.configFilePath()));
        if (!result.completed()) return result;

        Subscription blocked = s.withStatus(SubscriptionStatus.BLOCKED);
        subscriptions.updateSubscription(blocked);
        notifyUser(blocked, messages.blockedByAdmin(blocked, planName(blocked)));
        return new AdminActionResult(Action.BLOCK, s.id(), Outcome.COMPLETED, SubscriptionStatus.BLOCKED,
                "Subscription #" + s.id() + " blocked");
    }

    public AdminActionResult unblock(long subscriptionId) {
        Subscription s = subscriptions.getSubscriptionById(subscriptionId);
        requireStatus(s, Action.UNBLOCK, SubscriptionStatus.BLOCKED);
        Server server = servers.getServerById(s.serverId());

        AdminActionResult result = await(Action.UNBLOCK, s, () -> engine.unblockClient(server, s.configFilePath()));
        if (!result.completed()) return result;

        Subscription active = s.withStatus(SubscriptionStatus.ACTIVE);
        subscriptions.updateSubscription(active);
        notifyUser(active, messages.unblockedByAdmin(active, planName(active)));
        return new AdminActionResult(Action.UNBLOCK, s.id(), Outcome.COMPLETED, SubscriptionStatus.ACTIVE,
                "Subscription #" + s.id() + " unblocked");
    }

    public AdminActionResult revoke(long subscriptionId) {
        Subscription s = subscriptions.getSubscriptionById(subscriptionId);
        requireStatus(s, Action.REVOKE, SubscriptionStatus.ACTIVE, SubscriptionStatus.BLOCKED);
        Server server = servers.getServerById(s.serverId());

        AdminActionResult remote = await(Action.REVOKE, s, () -> engine.revokeClientConfig(server, s.configFilePath()));

        Subscription revoked = s.withStatus(SubscriptionStatus.REVOKED);
        subscriptions.updateSubscription(revoked);

        if (!remote.completed()) {
            log.warn("Subscription {} marked revoked but its peer may still exist on server {}: {}",
                    s.id(), s.serverId(), remote.message());
            return new AdminActionResult(Action.REVOKE, s.id(), remote.outcome(), SubscriptionStatus.REVOKED,
                    "Subscription #" + s.id() + " marked revoked, but the server was not updated: " + remote.message());
        }

        try {
            servers.releaseSlot(s.serverId());
        } catch (RuntimeException e) {
            log.warn("Failed to release slot on server {} for subscription {}", s.serverId(), s.id(), e);
        }
        notifyUser(revoked, messages.revokedByAdmin(revoked, planName(revoked)));
        return new AdminActionResult(Action.REVOKE, s.id(), Outcome.COMPLETED, SubscriptionStatus.REVOKED,
                "Subscription #" + s.id() + " revoked");
    }

    private AdminActionResult await(Action action, Subscription s, Runnable remoteOp) {
        CompletableFuture<Void> pending = CompletableFuture.runAsync(remoteOp, executor);
        try {
            pending.get(actionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return new AdminActionResult(action, s.id(), Outcome.COMPLETED, s.status(), "ok");
        } catch (TimeoutException e) {
            pending.whenComplete((v, err) -> {
                if (err == null) {
                    log.warn("{} of subscription {} completed after the admin timeout", action, s.id());
                } else {
                    log.warn("{} of subscription {} failed after the admin timeout: {}", action, s.id(), err.getMessage());
                }
            });
            return new AdminActionResult(action, s.id(), Outcome.TIMED_OUT, s.status(),
                    "Server did not answer within " + actionTimeout.toSeconds() + "s; the operation may still complete");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("{} of subscription {} failed", action, s.id(), cause);
            return new AdminActionResult(action, s.id(), Outcome.FAILED, s.status(), String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new AdminActionResult(action, s.id(), Outcome.FAILED, s.status(), "Interrupted while waiting for the server");
        }
    }

    private static void requireStatus(Subscription s, Action action, SubscriptionStatus... allowed) {
        for (SubscriptionStatus st : allowed) {
            if (s.status() == st) return;
        }
        throw new IllegalStateException("Cannot " + action.name().toLowerCase(Locale.ROOT) + " subscription #" + s.id()
                + " in status " + s.status().code());
    }

    private void notifyUser(Subscription s, String text) {
        try {
            notifier.notify(subscriptions.getUserById(s.userId()).telegramId(), text);
        } catch (RuntimeException e) {
            log.warn("Failed to notify user {} about subscription {}: {}", s.userId(), s.id(), e.getMessage());
        }
    }

    private String planName(Subscription s) {
        try {
            return subscriptions.getSubscriptionPlanById(s.planId()).name();
        } catch (RuntimeException e) {
            return "#" + s.planId();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
