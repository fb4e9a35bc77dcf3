package com.wgbot.application.ports;

import com.wgbot.domain.model.Subscription;
import com.wgbot.domain.model.SubscriptionPlan;
import com.wgbot.domain.model.User;

import java.util.List;

/**
 * Persistent store for subscriptions and the records they reference.
 * Lookups by id throw {@link RecordNotFoundException} when the record is absent.
 */
public interface SubscriptionStorePort {

    List<Subscription> getActiveSubscriptions();

    Subscription getSubscriptionById(long id);

    void updateSubscription(Subscription subscription);

    /**
     * Persists a new subscription; the returned copy carries the assigned id.
     */
    Subscription createSubscription(Subscription subscription);

    User getUserById(long id);

    SubscriptionPlan getSubscriptionPlanById(long id);

    List<User> getAllAdmins();
}
