package com.wgbot.application.service;

import com.wgbot.application.lifecycle.SubscriptionMessages;
import com.wgbot.application.ports.NotifierPort;
import com.wgbot.application.ports.ServerStorePort;
import com.wgbot.application.ports.SubscriptionStorePort;
import com.wgbot.application.provisioning.ProvisioningEngine;
import com.wgbot.application.provisioning.ProvisioningError;
import com.wgbot.application.provisioning.ProvisioningException;
import com.wgbot.domain.model.Server;
import com.wgbot.domain.model.Subscription;
import com.wgbot.domain.model.SubscriptionPlan;
import com.wgbot.domain.model.SubscriptionStatus;
import com.wgbot.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Turns a paid plan into a working client config.
 *
 * Order: reserve a server slot, set the server up, create the peer, then persist the subscription.
 * Any failure gives the slot back; nothing is persisted for a peer that was not created.
 */
public class PurchaseProvisioningService {

    private static final Logger log = LoggerFactory.getLogger(PurchaseProvisioningService.class);

    private final SubscriptionStorePort subscriptions;
    private final ServerStorePort servers;
    private final ProvisioningEngine engine;
    private final NotifierPort notifier;
    private final SubscriptionMessages messages;
    private final Clock clock;

    public PurchaseProvisioningService(
            SubscriptionStorePort subscriptions,
            ServerStorePort servers,
            ProvisioningEngine engine,
            NotifierPort notifier,
            SubscriptionMessages messages,
            Clock clock
    ) {
        this.subscriptions = subscriptions;
        this.servers = servers;
        this.engine = engine;
        this.notifier = notifier;
        this.messages = messages;
        this.clock = clock;
    }

    public static String clientNameFor(User user) {
        return "user_" + user.id();
    }

    public Subscription provision(long userId, long planId) {
        User user = subscriptions.getUserById(userId);
        SubscriptionPlan plan = subscriptions.getSubscriptionPlanById(planId);
        if (!plan.active()) {
            throw new IllegalArgumentException("Plan " + plan.name() + " is not available");
        }

        for (Server candidate : servers.getAllServers()) {
            if (!candidate.hasCapacity()) continue;
            if (!servers.tryReserveSlot(candidate.id())) {
                log.debug("Server {} filled up concurrently, trying next", candidate.id());
                continue;
            }
            Subscription created = provisionOn(candidate, user, plan);
            try {
                notifier.notify(user.telegramId(), messages.provisioned(created, plan.name()));
            } catch (RuntimeException e) {
                log.warn("Subscription {} created but user {} could not be notified: {}", created.id(), user.id(), e.getMessage());
            }
            return created;
        }
        throw new ProvisioningException(ProvisioningError.NO_CAPACITY, "No active server has a free client slot");
    }

    private Subscription provisionOn(Server server, User user, SubscriptionPlan plan) {
        Path config;
        try {
            engine.setupServer(server);
            config = engine.createClientConfig(server, clientNameFor(user));
        } catch (RuntimeException e) {
            releaseQuietly(server);
            throw e;
        }

        Instant start = clock.instant();
        Subscription draft = new Subscription(
                0,
                user.id(),
                server.id(),
                plan.id(),
                start,
                start.plus(Duration.ofDays(plan.durationDays())),
                SubscriptionStatus.ACTIVE,
                config.toString(),
                0,
                null
        );
        try {
            Subscription created = subscriptions.createSubscription(draft);
            log.info("Subscription {} provisioned for user {} on server {}", created.id(), user.id(), server.id());
            return created;
        } catch (RuntimeException e) {
            log.error("Failed to store subscription for user {}, removing peer {}", user.id(), config, e);
            try {
                engine.revokeClientConfig(server, config.toString());
            } catch (RuntimeException cleanup) {
                log.error("Orphan peer {} left on server {}", config, server.id(), cleanup);
            }
            releaseQuietly(server);
            throw e;
        }
    }

    private void releaseQuietly(Server server) {
        try {
            servers.releaseSlot(server.id());
        } catch (RuntimeException e) {
            log.warn("Failed to release slot on server {}", server.id(), e);
        }
    }
}
