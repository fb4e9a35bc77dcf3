package com.wgbot.api.sweep;

import com.wgbot.api.config.WgBotProperties;
import com.wgbot.api.metrics.SweepMetrics;
import com.wgbot.application.lifecycle.SweepScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts periodic subscription sweeps with the application context and stops them on shutdown.
 * Disable with wgbot.sweep.enabled=false (manual sweeps through the admin API still work).
 */
@Component
public class SubscriptionSweepLifecycle implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionSweepLifecycle.class);

  private final SweepScheduler scheduler;
  private final WgBotProperties props;

  private final AtomicBoolean running = new AtomicBoolean(false);

  public SubscriptionSweepLifecycle(SweepScheduler scheduler, SweepMetrics metrics, WgBotProperties props) {
    this.scheduler = scheduler;
    this.props = props;
    scheduler.onReport(metrics::record);
  }

  @Override
  public void start() {
    if (running.get()) return;

    if (!props.sweep().enabled()) {
      log.info("Periodic subscription sweeps disabled (wgbot.sweep.enabled=false)");
      return;
    }

    scheduler.start();
    running.set(true);
  }

  @Override
  public void stop() {
    if (!running.getAndSet(false)) return;
    scheduler.stop();
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  // After the web server and datasource are up, before they go down.
  @Override
  public int getPhase() {
    return Integer.MAX_VALUE - 1000;
  }

  @Override
  public boolean isAutoStartup() {
    return true;
  }

  @Override
  public void stop(Runnable callback) {
    stop();
    callback.run();
  }
}
