package com.wgbot.api.wiring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wgbot.api.config.WgBotProperties;
import com.wgbot.api.sweep.ObservedSubscriptionReconciler;
import com.wgbot.application.lifecycle.SubscriptionMessages;
import com.wgbot.application.lifecycle.SubscriptionReconciler;
import com.wgbot.application.lifecycle.SweepScheduler;
import com.wgbot.application.ports.NotifierPort;
import com.wgbot.application.ports.RemoteHostConnector;
import com.wgbot.application.ports.ServerStorePort;
import com.wgbot.application.ports.SubscriptionStorePort;
import com.wgbot.application.provisioning.ProvisioningEngine;
import com.wgbot.application.provisioning.WireguardLayout;
import com.wgbot.application.provisioning.impl.ClientArtifactStore;
import com.wgbot.application.provisioning.impl.WireguardProvisioningEngine;
import com.wgbot.application.service.PurchaseProvisioningService;
import com.wgbot.application.service.ServerAdminService;
import com.wgbot.application.service.SubscriptionAdminService;
import com.wgbot.infrastructure.notification.LoggingNotifier;
import com.wgbot.infrastructure.notification.TelegramNotifier;
import com.wgbot.infrastructure.ssh.JschRemoteHostConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class WgBotWiringConfig {

  private static final Logger log = LoggerFactory.getLogger(WgBotWiringConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public RemoteHostConnector remoteHostConnector(WgBotProperties props) {
    return new JschRemoteHostConnector(props.ssh().toSettings());
  }

  @Bean
  public WireguardLayout wireguardLayout(WgBotProperties props) {
    return props.wireguard().toLayout();
  }

  @Bean
  public ClientArtifactStore clientArtifactStore(WgBotProperties props) {
    return new ClientArtifactStore(Path.of(props.artifacts().dir()));
  }

  @Bean
  public ProvisioningEngine provisioningEngine(
      RemoteHostConnector connector,
      WireguardLayout layout,
      ClientArtifactStore artifacts
  ) {
    return new WireguardProvisioningEngine(connector, layout, artifacts);
  }

  /**
   * Without a bot token, messages are only logged (local/dev).
   */
  @Bean
  public NotifierPort notifierPort(WgBotProperties props, ObjectMapper objectMapper) {
    WgBotProperties.Telegram telegram = props.telegram();
    if (!telegram.configured()) {
      log.warn("wgbot.telegram.bot-token is empty, notifications go to the log only. Set WGBOT_TELEGRAM_BOT_TOKEN.");
      return new LoggingNotifier();
    }
    return new TelegramNotifier(telegram.botToken(), telegram.baseUrl(), objectMapper);
  }

  @Bean
  public SubscriptionMessages subscriptionMessages(WgBotProperties props) {
    return new SubscriptionMessages(props.sweep().zoneId());
  }

  @Bean
  public SubscriptionReconciler subscriptionReconciler(
      SubscriptionStorePort subscriptions,
      ServerStorePort servers,
      ProvisioningEngine engine,
      NotifierPort notifier,
      SubscriptionMessages messages,
      WgBotProperties props
  ) {
    return new ObservedSubscriptionReconciler(subscriptions, servers, engine, notifier, messages, props.sweep().warningDays());
  }

  @Bean
  public SweepScheduler sweepScheduler(SubscriptionReconciler reconciler, WgBotProperties props, Clock clock) {
    return new SweepScheduler(reconciler, props.sweep().interval(), clock);
  }

  @Bean
  public SubscriptionAdminService subscriptionAdminService(
      SubscriptionStorePort subscriptions,
      ServerStorePort servers,
      ProvisioningEngine engine,
      NotifierPort notifier,
      SubscriptionMessages messages,
      WgBotProperties props
  ) {
    return new SubscriptionAdminService(subscriptions, servers, engine, notifier, messages, props.admin().actionTimeout());
  }

  @Bean
  public PurchaseProvisioningService purchaseProvisioningService(
      SubscriptionStorePort subscriptions,
      ServerStorePort servers,
      ProvisioningEngine engine,
      NotifierPort notifier,
      SubscriptionMessages messages,
      Clock clock
  ) {
    return new PurchaseProvisioningService(subscriptions, servers, engine, notifier, messages, clock);
  }

  @Bean
  public ServerAdminService serverAdminService(ServerStorePort servers, ProvisioningEngine engine) {
    return new ServerAdminService(servers, engine);
  }
}
