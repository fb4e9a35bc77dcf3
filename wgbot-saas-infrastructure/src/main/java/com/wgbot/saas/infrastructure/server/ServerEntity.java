package com.wgbot.saas.infrastructure.server;

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
    name = "servers",
    indexes = @Index(name = "ix_servers_active", columnList = "active")
)
public class ServerEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "address", nullable = false, length = 255)
  private String address;

  @Column(name = "ssh_port", nullable = false)
  private int sshPort;

  @Column(name = "ssh_user", nullable = false, length = 64)
  private String sshUser;

  @Column(name = "ssh_password", length = 255)
  private String sshPassword;

  @Column(name = "max_clients", nullable = false)
  private int maxClients;

  @Column(name = "current_clients", nullable = false)
  private int currentClients;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected ServerEntity() {}

  public ServerEntity(String address, int sshPort, String sshUser, String sshPassword,
                      int maxClients, boolean active, Instant createdAt) {
    this.address = address;
    this.sshPort = sshPort;
    this.sshUser = sshUser;
    this.sshPassword = sshPassword;
    this.maxClients = maxClients;
    this.currentClients = 0;
    this.active = active;
    this.createdAt = createdAt;
  }

  public Long getId() { return id; }
  public String getAddress() { return address; }
  public int getSshPort() { return sshPort; }
  public String getSshUser() { return sshUser; }
  public String getSshPassword() { return sshPassword; }
  public int getMaxClients() { return maxClients; }
  public int getCurrentClients() { return currentClients; }
  public boolean isActive() { return active; }
  public Instant getCreatedAt() { return createdAt; }

  public void setAddress(String address) { this.address = address; }
  public void setSshPort(int sshPort) { this.sshPort = sshPort; }
  public void setSshUser(String sshUser) { this.sshUser = sshUser; }
  public void setSshPassword(String sshPassword) { this.sshPassword = sshPassword; }
  public void setMaxClients(int maxClients) { this.maxClients = maxClients; }
  public void setCurrentClients(int currentClients) { this.currentClients = currentClients; }
  public void setActive(boolean active) { this.active = active; }
}
