package com.wgbot.saas.infrastructure.subscription;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, Long> {

  List<SubscriptionEntity> findAllByStatusOrderByIdAsc(String status);

  List<SubscriptionEntity> findAllByUserIdOrderByIdDesc(long userId);

  long countByStatus(String status);
}
