package com.wgbot.saas.infrastructure.subscription;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(
    name = "subscriptions",
    indexes = {
        @Index(name = "ix_subscriptions_user", columnList = "user_id"),
        @Index(name = "ix_subscriptions_status", columnList = "status"),
        @Index(name = "ix_subscriptions_server", columnList = "server_id")
    }
)
public class SubscriptionEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "user_id", nullable = false)
  private long userId;

  @Column(name = "server_id", nullable = false)
  private long serverId;

  @Column(name = "plan_id", nullable = false)
  private long planId;

  @Column(name = "start_date", nullable = false)
  private Instant startDate;

  @Column(name = "end_date", nullable = false)
  private Instant endDate;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "config_file_path", length = 512)
  private String configFilePath;

  @Column(name = "data_usage", nullable = false)
  private long dataUsage;

  @Column(name = "last_connection_at")
  private Instant lastConnectionAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SubscriptionEntity() {}

  public SubscriptionEntity(
      long userId,
      long serverId,
      long planId,
      Instant startDate,
      Instant endDate,
      String status,
      String configFilePath,
      Instant updatedAt
  ) {
    this.userId = userId;
    this.serverId = serverId;
    this.planId = planId;
    this.startDate = startDate;
    this.endDate = endDate;
    this.status = status;
    this.configFilePath = configFilePath;
    this.dataUsage = 0L;
    this.updatedAt = updatedAt;
  }

  public Long getId() { return id; }
  public long getUserId() { return userId; }
  public long getServerId() { return serverId; }
  public long getPlanId() { return planId; }
  public Instant getStartDate() { return startDate; }
  public Instant getEndDate() { return endDate; }
  public String getStatus() { return status; }
  public String getConfigFilePath() { return configFilePath; }
  public long getDataUsage() { return dataUsage; }
  public Instant getLastConnectionAt() { return lastConnectionAt; }
  public Instant getUpdatedAt() { return updatedAt; }

  public void setEndDate(Instant endDate) { this.endDate = endDate; }
  public void setStatus(String status) { this.status = status; }
  public void setConfigFilePath(String configFilePath) { this.configFilePath = configFilePath; }
  public void setDataUsage(long dataUsage) { this.dataUsage = dataUsage; }
  public void setLastConnectionAt(Instant lastConnectionAt) { this.lastConnectionAt = lastConnectionAt; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
