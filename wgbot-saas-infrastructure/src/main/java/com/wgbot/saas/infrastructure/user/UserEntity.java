package com.wgbot.saas.infrastructure.user;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(
    name = "users",
    uniqueConstraints = @UniqueConstraint(name = "uk_users_telegram_id", columnNames = "telegram_id"),
    indexes = @Index(name = "ix_users_admin", columnList = "is_admin")
)
public class UserEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "telegram_id", nullable = false)
  private long telegramId;

  @Column(name = "username", length = 64)
  private String username;

  @Column(name = "first_name", length = 128)
  private String firstName;

  @Column(name = "last_name", length = 128)
  private String lastName;

  @Column(name = "is_admin", nullable = false)
  private boolean admin;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected UserEntity() {}

  public UserEntity(long telegramId, String username, String firstName, String lastName, boolean admin, Instant createdAt) {
    this.telegramId = telegramId;
    this.username = username;
    this.firstName = firstName;
    this.lastName = lastName;
    this.admin = admin;
    this.createdAt = createdAt;
  }

  public Long getId() { return id; }
  public long getTelegramId() { return telegramId; }
  public String getUsername() { return username; }
  public String getFirstName() { return firstName; }
  public String getLastName() { return lastName; }
  public boolean isAdmin() { return admin; }
  public Instant getCreatedAt() { return createdAt; }

  public void setUsername(String username) { this.username = username; }
  public void setAdmin(boolean admin) { this.admin = admin; }
}
