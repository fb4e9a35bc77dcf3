package com.wgbot.saas.infrastructure.plan;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;

@Entity
@Table(name = "subscription_plans")
public class SubscriptionPlanEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "description", length = 1000)
  private String description;

  @Column(name = "price", nullable = false, precision = 10, scale = 2)
  private BigDecimal price;

  @Column(name = "duration_days", nullable = false)
  private int durationDays;

  @Column(name = "active", nullable = false)
  private boolean active;

  protected SubscriptionPlanEntity() {}

  public SubscriptionPlanEntity(String name, String description, BigDecimal price, int durationDays, boolean active) {
    this.name = name;
    this.description = description;
    this.price = price;
    this.durationDays = durationDays;
    this.active = active;
  }

  public Long getId() { return id; }
  public String getName() { return name; }
  public String getDescription() { return description; }
  public BigDecimal getPrice() { return price; }
  public int getDurationDays() { return durationDays; }
  public boolean isActive() { return active; }
}
