package com.wgbot.api.config;

import com.wgbot.application.lifecycle.SubscriptionReconciler;
import com.wgbot.application.provisioning.WireguardLayout;
import com.wgbot.infrastructure.ssh.SshSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * All wgbot settings. Secrets (bot token, admin keys, DB password) come from env, see application.yml.
 */
@ConfigurationProperties(prefix = "wgbot")
public record WgBotProperties(
    Ssh ssh,
    Wireguard wireguard,
    Sweep sweep,
    Admin admin,
    Telegram telegram,
    Artifacts artifacts
) {

  public WgBotProperties {
    if (ssh == null) ssh = new Ssh(null, null, null);
    if (wireguard == null) wireguard = new Wireguard(null, null, null, null, null, null, null, null);
    if (sweep == null) sweep = new Sweep(null, null, null, null);
    if (admin == null) admin = new Admin(null, null, null);
    if (telegram == null) telegram = new Telegram(null, null);
    if (artifacts == null) artifacts = new Artifacts(null);
  }

  /**
   * @param strictHostKeyChecking "no" by default: servers are added by admins with bare address + password
   */
  public record Ssh(String strictHostKeyChecking, String knownHostsFile, Duration channelTimeout) {

    public SshSettings toSettings() {
      return new SshSettings(strictHostKeyChecking, knownHostsFile, channelTimeout);
    }
  }

  public record Wireguard(
      String interfaceName,
      String configDir,
      String subnetPrefix,
      Integer listenPort,
      String clientDns,
      Integer persistentKeepalive,
      Duration connectTimeout,
      Duration setupTimeout
  ) {

    public WireguardLayout toLayout() {
      WireguardLayout d = WireguardLayout.defaults();
      return new WireguardLayout(
          interfaceName == null ? d.interfaceName() : interfaceName,
          configDir == null ? d.configDir() : configDir,
          subnetPrefix == null ? d.subnetPrefix() : subnetPrefix,
          listenPort == null ? d.listenPort() : listenPort,
          clientDns == null ? d.clientDns() : clientDns,
          persistentKeepalive == null ? d.persistentKeepalive() : persistentKeepalive,
          connectTimeout == null ? d.connectTimeout() : connectTimeout,
          setupTimeout == null ? d.setupTimeout() : setupTimeout
      );
    }
  }

  /**
   * @param zone time zone used for dates in user-facing messages
   */
  public record Sweep(Boolean enabled, Duration interval, Integer warningDays, String zone) {

    public Sweep {
      if (enabled == null) enabled = true;
      if (interval == null) interval = Duration.ofHours(1);
      if (warningDays == null) warningDays = SubscriptionReconciler.DEFAULT_WARNING_DAYS;
      if (zone == null || zone.isBlank()) zone = "UTC";
    }

    public ZoneId zoneId() {
      return ZoneId.of(zone);
    }
  }

  public record Admin(List<String> apiKeys, String apiKeyHeader, Duration actionTimeout) {

    public Admin {
      apiKeys = apiKeys == null ? List.of() : apiKeys.stream().filter(k -> k != null && !k.isBlank()).toList();
      if (apiKeyHeader == null || apiKeyHeader.isBlank()) apiKeyHeader = "X-Admin-Api-Key";
      if (actionTimeout == null) actionTimeout = Duration.ofSeconds(10);
    }
  }

  public record Telegram(String botToken, String baseUrl) {

    public boolean configured() {
      return botToken != null && !botToken.isBlank();
    }
  }

  public record Artifacts(String dir) {

    public Artifacts {
      if (dir == null || dir.isBlank()) dir = "vpn_configs";
    }
  }
}
