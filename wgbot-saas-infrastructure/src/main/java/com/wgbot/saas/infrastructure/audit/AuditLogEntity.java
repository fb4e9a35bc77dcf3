package com.wgbot.saas.infrastructure.audit;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(
    name = "audit_log",
    indexes = {
        @Index(name = "ix_audit_log_created_at", columnList = "created_at"),
        @Index(name = "ix_audit_log_target", columnList = "target_type,target_id")
    }
)
public class AuditLogEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "actor", nullable = false, length = 64)
  private String actor;

  @Column(name = "action", nullable = false, length = 64)
  private String action;

  @Column(name = "target_type", nullable = false, length = 32)
  private String targetType;

  @Column(name = "target_id", nullable = false, length = 64)
  private String targetId;

  @Column(name = "outcome", nullable = false, length = 32)
  private String outcome;

  @Column(name = "detail", length = 1000)
  private String detail;

  @Column(name = "request_id", length = 128)
  private String requestId;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected AuditLogEntity() {}

  public AuditLogEntity(String actor, String action, String targetType, String targetId,
                        String outcome, String detail, String requestId, Instant createdAt) {
    this.actor = actor;
    this.action = action;
    this.targetType = targetType;
    this.targetId = targetId;
    this.outcome = outcome;
    this.detail = detail;
    this.requestId = requestId;
    this.createdAt = createdAt;
  }

  public Long getId() { return id; }
  public String getActor() { return actor; }
  public String getAction() { return action; }
  public String getTargetType() { return targetType; }
  public String getTargetId() { return targetId; }
  public String getOutcome() { return outcome; }
  public String getDetail() { return detail; }
  public String getRequestId() { return requestId; }
  public Instant getCreatedAt() { return createdAt; }
}
