package com.wgbot.api.metrics;

import com.wgbot.application.lifecycle.SweepReport;
import com.wgbot.application.lifecycle.SweepScheduler;
import com.wgbot.domain.model.SubscriptionStatus;
import com.wgbot.saas.infrastructure.subscription.SubscriptionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Sweep metrics.
 *
 * Exposes:
 * - wgbot.sweep.runs, wgbot.sweep.skipped
 * - wgbot.subscriptions.expired, wgbot.subscriptions.warned, wgbot.revoke.failures
 * - wgbot.subscriptions.active (gauge)
 */
@Component
public class SweepMetrics {

  private final Counter runs;
  private final Counter loadFailures;
  private final Counter expired;
  private final Counter warned;
  private final Counter revokeFailures;

  public SweepMetrics(MeterRegistry registry, SweepScheduler scheduler, SubscriptionRepository subscriptions) {
    Gauge.builder("wgbot.subscriptions.active", subscriptions, r -> r.countByStatus(SubscriptionStatus.ACTIVE.code()))
        .description("Subscriptions currently active")
        .register(registry);
    FunctionCounter.builder("wgbot.sweep.skipped", scheduler, SweepScheduler::skippedTicks)
        .description("Sweep ticks skipped because the previous sweep was still running")
        .register(registry);

    this.runs = Counter.builder("wgbot.sweep.runs")
        .description("Completed subscription sweeps")
        .register(registry);
    this.loadFailures = Counter.builder("wgbot.sweep.load_failures")
        .description("Sweeps aborted because active subscriptions could not be loaded")
        .register(registry);
    this.expired = Counter.builder("wgbot.subscriptions.expired")
        .description("Subscriptions moved to expired")
        .register(registry);
    this.warned = Counter.builder("wgbot.subscriptions.warned")
        .description("Near-expiry warnings delivered")
        .register(registry);
    this.revokeFailures = Counter.builder("wgbot.revoke.failures")
        .description("Expired subscriptions whose peer could not be revoked")
        .register(registry);
  }

  public void record(SweepReport report) {
    runs.increment();
    if (report.loadFailed()) {
      loadFailures.increment();
      return;
    }
    expired.increment(report.expired());
    warned.increment(report.warned());
    revokeFailures.increment(report.revokeFailures());
  }
}
