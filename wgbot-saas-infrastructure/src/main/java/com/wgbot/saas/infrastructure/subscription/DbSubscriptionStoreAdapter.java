package com.wgbot.saas.infrastructure.subscription;

import com.wgbot.application.ports.RecordNotFoundException;
import com.wgbot.application.ports.SubscriptionStorePort;
import com.wgbot.domain.model.Subscription;
import com.wgbot.domain.model.SubscriptionPlan;
import com.wgbot.domain.model.SubscriptionStatus;
import com.wgbot.domain.model.User;
import com.wgbot.saas.infrastructure.plan.SubscriptionPlanEntity;
import com.wgbot.saas.infrastructure.plan.SubscriptionPlanRepository;
import com.wgbot.saas.infrastructure.user.UserEntity;
import com.wgbot.saas.infrastructure.user.UserRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Maps subscription, user and plan rows to the domain records used by the lifecycle services.
 * Statuses are stored as their lowercase codes.
 */
@Component
public class DbSubscriptionStoreAdapter implements SubscriptionStorePort {

  private final SubscriptionRepository subscriptions;
  private final UserRepository users;
  private final SubscriptionPlanRepository plans;
  private final Clock clock;

  public DbSubscriptionStoreAdapter(
      SubscriptionRepository subscriptions,
      UserRepository users,
      SubscriptionPlanRepository plans,
      Clock clock
  ) {
    this.subscriptions = subscriptions;
    this.users = users;
    this.plans = plans;
    this.clock = clock;
  }

  @Override
  @Transactional(readOnly = true)
  public List<Subscription> getActiveSubscriptions() {
    return subscriptions.findAllByStatusOrderByIdAsc(SubscriptionStatus.ACTIVE.code()).stream()
        .map(DbSubscriptionStoreAdapter::toDomain)
        .toList();
  }

  @Override
  @Transactional(readOnly = true)
  public Subscription getSubscriptionById(long id) {
    return subscriptions.findById(id)
        .map(DbSubscriptionStoreAdapter::toDomain)
        .orElseThrow(() -> new RecordNotFoundException("Subscription", id));
  }

  @Override
  @Transactional
  public void updateSubscription(Subscription s) {
    SubscriptionEntity e = subscriptions.findById(s.id())
        .orElseThrow(() -> new RecordNotFoundException("Subscription", s.id()));
    e.setEndDate(s.endDate());
    e.setStatus(s.status().code());
    e.setConfigFilePath(s.configFilePath());
    e.setDataUsage(s.dataUsage());
    e.setLastConnectionAt(s.lastConnectionAt());
    e.setUpdatedAt(clock.instant());
    subscriptions.save(e);
  }

  @Override
  @Transactional
  public Subscription createSubscription(Subscription s) {
    SubscriptionEntity saved = subscriptions.save(new SubscriptionEntity(
        s.userId(),
        s.serverId(),
        s.planId(),
        s.startDate(),
        s.endDate(),
        s.status().code(),
        s.configFilePath(),
        clock.instant()
    ));
    return toDomain(saved);
  }

  @Override
  @Transactional(readOnly = true)
  public User getUserById(long id) {
    return users.findById(id)
        .map(DbSubscriptionStoreAdapter::toDomain)
        .orElseThrow(() -> new RecordNotFoundException("User", id));
  }

  @Override
  @Transactional(readOnly = true)
  public SubscriptionPlan getSubscriptionPlanById(long id) {
    return plans.findById(id)
        .map(DbSubscriptionStoreAdapter::toDomain)
        .orElseThrow(() -> new RecordNotFoundException("SubscriptionPlan", id));
  }

  @Override
  @Transactional(readOnly = true)
  public List<User> getAllAdmins() {
    return users.findAllByAdminTrueOrderByIdAsc().stream()
        .map(DbSubscriptionStoreAdapter::toDomain)
        .toList();
  }

  static Subscription toDomain(SubscriptionEntity e) {
    return new Subscription(
        e.getId(),
        e.getUserId(),
        e.getServerId(),
        e.getPlanId(),
        e.getStartDate(),
        e.getEndDate(),
        SubscriptionStatus.fromCode(e.getStatus()),
        e.getConfigFilePath(),
        e.getDataUsage(),
        e.getLastConnectionAt()
    );
  }

  static User toDomain(UserEntity e) {
    return new User(e.getId(), e.getTelegramId(), e.getUsername(), e.getFirstName(), e.getLastName(), e.isAdmin());
  }

  static SubscriptionPlan toDomain(SubscriptionPlanEntity e) {
    return new SubscriptionPlan(e.getId(), e.getName(), e.getDescription(), e.getPrice(), e.getDurationDays(), e.isActive());
  }
}
