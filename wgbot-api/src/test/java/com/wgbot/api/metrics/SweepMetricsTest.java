package com.wgbot.api.metrics;

import com.wgbot.application.lifecycle.SubscriptionReconciler;
import com.wgbot.application.lifecycle.SweepReport;
import com.wgbot.application.lifecycle.SweepScheduler;
import com.wgbot.saas.infrastructure.subscription.SubscriptionRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SweepMetricsTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final SubscriptionRepository subscriptions = mock(SubscriptionRepository.class);
  private final SweepScheduler scheduler = new SweepScheduler(mock(SubscriptionReconciler.class), Duration.ofHours(1), Clock.systemUTC());
  private final SweepMetrics metrics = new SweepMetrics(registry, scheduler, subscriptions);

  @Test
  void reportsAccumulate() {
    Instant at = Instant.parse("2024-06-01T00:00:00Z");
    metrics.record(new SweepReport(at, 10, List.of(1L, 2L), 3, 0, 1, 0, false));
    metrics.record(new SweepReport(at, 8, List.of(5L), 0, 1, 0, 0, false));

    assertThat(registry.get("wgbot.sweep.runs").counter().count()).isEqualTo(2.0);
    assertThat(registry.get("wgbot.subscriptions.expired").counter().count()).isEqualTo(3.0);
    assertThat(registry.get("wgbot.subscriptions.warned").counter().count()).isEqualTo(3.0);
    assertThat(registry.get("wgbot.revoke.failures").counter().count()).isEqualTo(1.0);
  }

  @Test
  void failedLoadOnlyCountsRun() {
    metrics.record(SweepReport.loadFailed(Instant.now()));

    assertThat(registry.get("wgbot.sweep.runs").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("wgbot.sweep.load_failures").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("wgbot.subscriptions.expired").counter().count()).isZero();
  }

  @Test
  void activeGaugeReadsRepository() {
    when(subscriptions.countByStatus("active")).thenReturn(7L);

    assertThat(registry.get("wgbot.subscriptions.active").gauge().value()).isEqualTo(7.0);
    assertThat(registry.get("wgbot.sweep.skipped").functionCounter().count()).isZero();
  }
}
