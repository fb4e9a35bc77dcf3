package com.wgbot.api.sweep;

import com.wgbot.application.lifecycle.SubscriptionMessages;
import com.wgbot.application.lifecycle.SubscriptionReconciler;
import com.wgbot.application.lifecycle.SweepReport;
import com.wgbot.application.ports.NotifierPort;
import com.wgbot.application.ports.ServerStorePort;
import com.wgbot.application.ports.SubscriptionStorePort;
import com.wgbot.application.provisioning.ProvisioningEngine;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.UUID;

/**
 * Runs each sweep inside a {@code subscription.sweep} span with a {@code sweepId} in the MDC,
 * so every log line of one sweep can be correlated.
 */
public class ObservedSubscriptionReconciler extends SubscriptionReconciler {

  public static final String MDC_SWEEP_ID = "sweepId";

  private final Tracer otelTracer = GlobalOpenTelemetry.getTracer("wgbot-api");

  public ObservedSubscriptionReconciler(
      SubscriptionStorePort subscriptions,
      ServerStorePort servers,
      ProvisioningEngine engine,
      NotifierPort notifier,
      SubscriptionMessages messages,
      int warningDays
  ) {
    super(subscriptions, servers, engine, notifier, messages, warningDays);
  }

  @Override
  public SweepReport sweep(Instant now) {
    String sweepId = UUID.randomUUID().toString().substring(0, 8);
    MDC.put(MDC_SWEEP_ID, sweepId);

    Span span = otelTracer.spanBuilder("subscription.sweep")
        .setSpanKind(SpanKind.INTERNAL)
        .setAttribute("wgbot.sweep_id", sweepId)
        .startSpan();

    try (Scope scope = span.makeCurrent()) {
      SweepReport report = super.sweep(now);
      span.setAttribute("wgbot.sweep.scanned", report.scanned());
      span.setAttribute("wgbot.sweep.expired", report.expired());
      span.setAttribute("wgbot.sweep.warned", report.warned());
      span.setAttribute("wgbot.sweep.revoke_failures", report.revokeFailures());
      if (report.loadFailed()) {
        span.setStatus(StatusCode.ERROR, "active subscriptions could not be loaded");
      }
      return report;
    } catch (RuntimeException e) {
      span.recordException(e);
      span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
      throw e;
    } finally {
      span.end();
      MDC.remove(MDC_SWEEP_ID);
    }
  }
}
