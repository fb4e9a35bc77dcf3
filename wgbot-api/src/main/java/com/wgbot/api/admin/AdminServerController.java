package com.wgbot.api.admin;

import com.wgbot.api.security.AdminApiKeyFilter;
import com.wgbot.application.provisioning.ServerInspection;
import com.wgbot.application.service.ServerAdminService;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/servers")
public class AdminServerController {

  private final ServerAdminService servers;
  private final AdminAuditService audit;

  public AdminServerController(ServerAdminService servers, AdminAuditService audit) {
    this.servers = servers;
    this.audit = audit;
  }

  /**
   * Installs and configures WireGuard on the server. Safe to repeat.
   */
  @PostMapping("/{id}/setup")
  public Map<String, Object> setup(
      @RequestAttribute(name = AdminApiKeyFilter.ADMIN_ACTOR_ATTR, required = false) String actor,
      @PathVariable long id
  ) {
    try {
      servers.setup(id);
    } catch (RuntimeException e) {
      audit.logAdmin(actor, "SERVER_SETUP", "SERVER", id, "FAILED", e.getMessage());
      throw e;
    }
    audit.logAdmin(actor, "SERVER_SETUP", "SERVER", id, "COMPLETED", null);
    return Map.of("status", "ok", "serverId", id);
  }

  @GetMapping("/{id}/inspection")
  public Map<String, Object> inspect(@PathVariable long id) {
    ServerInspection inspection = servers.inspect(id);
    return Map.of(
        "serverId", inspection.serverId(),
        "wireguardInstalled", inspection.wireguardInstalled(),
        "registryPresent", inspection.registryPresent(),
        "peerCount", inspection.peerCount()
    );
  }
}
