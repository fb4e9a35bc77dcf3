package com.wgbot.api.admin;

import com.wgbot.api.security.AdminApiKeyFilter;
import com.wgbot.application.ports.SubscriptionStorePort;
import com.wgbot.application.service.AdminActionResult;
import com.wgbot.application.service.PurchaseProvisioningService;
import com.wgbot.application.service.SubscriptionAdminService;
import com.wgbot.domain.model.Subscription;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/subscriptions")
public class AdminSubscriptionController {

  private final SubscriptionStorePort subscriptions;
  private final SubscriptionAdminService adminService;
  private final PurchaseProvisioningService provisioning;
  private final AdminAuditService audit;
  private final Clock clock;

  public AdminSubscriptionController(
      SubscriptionStorePort subscriptions,
      SubscriptionAdminService adminService,
      PurchaseProvisioningService provisioning,
      AdminAuditService audit,
      Clock clock
  ) {
    this.subscriptions = subscriptions;
    this.adminService = adminService;
    this.provisioning = provisioning;
    this.audit = audit;
    this.clock = clock;
  }

  @GetMapping("/{id}")
  public Map<String, Object> get(@PathVariable long id) {
    return toView(subscriptions.getSubscriptionById(id));
  }

  /**
   * Provisions a client config for an already-paid plan and stores the new subscription.
   */
  @PostMapping
  public ResponseEntity<Map<String, Object>> create(
      @RequestAttribute(name = AdminApiKeyFilter.ADMIN_ACTOR_ATTR, required = false) String actor,
      @Valid @RequestBody CreateSubscriptionRequest req
  ) {
    Subscription created = provisioning.provision(req.userId(), req.planId());
    audit.logAdmin(actor, "SUBSCRIPTION_CREATE", "SUBSCRIPTION", created.id(), "COMPLETED",
        "user=" + req.userId() + " plan=" + req.planId() + " server=" + created.serverId());
    return ResponseEntity.status(HttpStatus.CREATED).body(toView(created));
  }

  @PostMapping("/{id}/block")
  public ResponseEntity<Map<String, Object>> block(
      @RequestAttribute(name = AdminApiKeyFilter.ADMIN_ACTOR_ATTR, required = false) String actor,
      @PathVariable long id
  ) {
    return respond(actor, adminService.block(id));
  }

  @PostMapping("/{id}/unblock")
  public ResponseEntity<Map<String, Object>> unblock(
      @RequestAttribute(name = AdminApiKeyFilter.ADMIN_ACTOR_ATTR, required = false) String actor,
      @PathVariable long id
  ) {
    return respond(actor, adminService.unblock(id));
  }

  @PostMapping("/{id}/revoke")
  public ResponseEntity<Map<String, Object>> revoke(
      @RequestAttribute(name = AdminApiKeyFilter.ADMIN_ACTOR_ATTR, required = false) String actor,
      @PathVariable long id
  ) {
    return respond(actor, adminService.revoke(id));
  }

  private ResponseEntity<Map<String, Object>> respond(String actor, AdminActionResult result) {
    audit.logAdmin(actor, "SUBSCRIPTION_" + result.action().name(), "SUBSCRIPTION", result.subscriptionId(),
        result.outcome().name(), result.message());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", result.completed() ? "ok" : "error");
    body.put("action", result.action().name().toLowerCase(Locale.ROOT));
    body.put("subscriptionId", result.subscriptionId());
    body.put("outcome", result.outcome().name().toLowerCase(Locale.ROOT));
    body.put("subscriptionStatus", result.status() == null ? null : result.status().code());
    body.put("message", result.message());

    HttpStatus status = switch (result.outcome()) {
      case COMPLETED -> HttpStatus.OK;
      case TIMED_OUT -> HttpStatus.ACCEPTED;
      case FAILED -> HttpStatus.BAD_GATEWAY;
    };
    return ResponseEntity.status(status).body(body);
  }

  private Map<String, Object> toView(Subscription s) {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("id", s.id());
    view.put("userId", s.userId());
    view.put("serverId", s.serverId());
    view.put("planId", s.planId());
    view.put("status", s.status().code());
    view.put("startDate", s.startDate().toString());
    view.put("endDate", s.endDate().toString());
    view.put("daysLeft", Math.max(0, s.daysLeft(clock.instant())));
    view.put("configFilePath", s.configFilePath());
    view.put("dataUsage", s.dataUsage());
    view.put("lastConnectionAt", s.lastConnectionAt() == null ? null : s.lastConnectionAt().toString());
    return view;
  }
}
