package com.wgbot.application.support;

import com.wgbot.application.ports.RecordNotFoundException;
import com.wgbot.application.ports.ServerStorePort;
import com.wgbot.application.ports.SubscriptionStorePort;
import com.wgbot.domain.model.Server;
import com.wgbot.domain.model.Subscription;
import com.wgbot.domain.model.SubscriptionPlan;
import com.wgbot.domain.model.SubscriptionStatus;
import com.wgbot.domain.model.User;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed implementation of both store ports with switchable failures.
 */
public class InMemoryStores implements SubscriptionStorePort, ServerStorePort {

    public final Map<Long, Subscription> subscriptions = new LinkedHashMap<>();
    public final Map<Long, User> users = new LinkedHashMap<>();
    public final Map<Long, SubscriptionPlan> plans = new LinkedHashMap<>();
    public final Map<Long, Server> servers = new LinkedHashMap<>();
    public final List<Subscription> updates = new ArrayList<>();
    public final Set<Long> failUpdatesFor = new HashSet<>();
    public boolean failCreate;
    public boolean failLoad;

    private final AtomicLong ids = new AtomicLong(1000);

    public synchronized InMemoryStores add(Subscription s) {
        subscriptions.put(s.id(), s);
        return this;
    }

    public synchronized InMemoryStores add(User u) {
        users.put(u.id(), u);
        return this;
    }

    public synchronized InMemoryStores add(SubscriptionPlan p) {
        plans.put(p.id(), p);
        return this;
    }

    public synchronized InMemoryStores add(Server s) {
        servers.put(s.id(), s);
        return this;
    }

    @Override
    public synchronized List<Subscription> getActiveSubscriptions() {
        if (failLoad) throw new IllegalStateException("database unavailable");
        return subscriptions.values().stream().filter(s -> s.status() == SubscriptionStatus.ACTIVE).toList();
    }

    @Override
    public synchronized Subscription getSubscriptionById(long id) {
        Subscription s = subscriptions.get(id);
        if (s == null) throw new RecordNotFoundException("Subscription", id);
        return s;
    }

    @Override
    public synchronized void updateSubscription(Subscription subscription) {
        if (failUpdatesFor.contains(subscription.id())) throw new IllegalStateException("update rejected");
        subscriptions.put(subscription.id(), subscription);
        updates.add(subscription);
    }

    @Override
    public synchronized Subscription createSubscription(Subscription s) {
        if (failCreate) throw new IllegalStateException("insert rejected");
        Subscription created = new Subscription(ids.incrementAndGet(), s.userId(), s.serverId(), s.planId(),
                s.startDate(), s.endDate(), s.status(), s.configFilePath(), s.dataUsage(), s.lastConnectionAt());
        subscriptions.put(created.id(), created);
        return created;
    }

    @Override
    public synchronized User getUserById(long id) {
        User u = users.get(id);
        if (u == null) throw new RecordNotFoundException("User", id);
        return u;
    }

    @Override
    public synchronized SubscriptionPlan getSubscriptionPlanById(long id) {
        SubscriptionPlan p = plans.get(id);
        if (p == null) throw new RecordNotFoundException("SubscriptionPlan", id);
        return p;
    }

    @Override
    public synchronized List<User> getAllAdmins() {
        return users.values().stream().filter(User::admin).toList();
    }

    @Override
    public synchronized Server getServerById(long id) {
        Server s = servers.get(id);
        if (s == null) throw new RecordNotFoundException("Server", id);
        return s;
    }

    @Override
    public synchronized List<Server> getAllServers() {
        return List.copyOf(servers.values());
    }

    @Override
    public synchronized void updateServer(Server server) {
        servers.put(server.id(), server);
    }

    @Override
    public synchronized boolean tryReserveSlot(long serverId) {
        Server s = servers.get(serverId);
        if (s == null || !s.hasCapacity()) return false;
        servers.put(serverId, s.withCurrentClients(s.currentClients() + 1));
        return true;
    }

    @Override
    public synchronized void releaseSlot(long serverId) {
        Server s = servers.get(serverId);
        if (s != null && s.currentClients() > 0) {
            servers.put(serverId, s.withCurrentClients(s.currentClients() - 1));
        }
    }
}
