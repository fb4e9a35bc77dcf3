package com.wgbot.saas.infrastructure.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLogEntity, Long> {

  List<AuditLogEntity> findTop50ByTargetTypeAndTargetIdOrderByCreatedAtDesc(String targetType, String targetId);
}
