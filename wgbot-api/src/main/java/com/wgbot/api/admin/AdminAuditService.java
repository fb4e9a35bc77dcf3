package com.wgbot.api.admin;

import com.wgbot.api.tracing.RequestIdFilter;
import com.wgbot.saas.infrastructure.audit.AuditLogEntity;
import com.wgbot.saas.infrastructure.audit.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class AdminAuditService {

  private static final Logger log = LoggerFactory.getLogger(AdminAuditService.class);

  private static final int MAX_DETAIL = 1000;

  private final AuditLogRepository audits;
  private final Clock clock;

  public AdminAuditService(AuditLogRepository audits, Clock clock) {
    this.audits = audits;
    this.clock = clock;
  }

  public void logAdmin(String actor, String action, String targetType, long targetId, String outcome, String detail) {
    log.info("Admin {} {} {}#{} -> {}", actor, action, targetType, targetId, outcome);
    audits.save(new AuditLogEntity(
        actor == null ? "admin:unknown" : actor,
        action,
        targetType,
        String.valueOf(targetId),
        outcome,
        truncate(detail),
        RequestIdFilter.currentRequestId(),
        clock.instant()
    ));
  }

  private static String truncate(String s) {
    if (s == null || s.length() <= MAX_DETAIL) return s;
    return s.substring(0, MAX_DETAIL);
  }
}
