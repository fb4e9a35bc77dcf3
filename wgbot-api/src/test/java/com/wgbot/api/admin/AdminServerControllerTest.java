package com.wgbot.api.admin;

import com.wgbot.application.provisioning.ProvisioningEngine;
import com.wgbot.application.provisioning.ProvisioningError;
import com.wgbot.application.provisioning.ProvisioningException;
import com.wgbot.application.provisioning.ServerInspection;
import com.wgbot.saas.infrastructure.server.ServerEntity;
import com.wgbot.saas.infrastructure.server.ServerRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AdminServerControllerTest {

  private static final String KEY = AdminApiSecurityTest.KEY;

  @Autowired MockMvc mvc;
  @Autowired ServerRepository servers;

  @MockBean ProvisioningEngine engine;

  @Test
  void setupSucceeds() throws Exception {
    ServerEntity server = servers.save(new ServerEntity("198.51.100.30", 22, "root", "pw", 10, true, Instant.now()));

    mvc.perform(post("/api/v1/admin/servers/" + server.getId() + "/setup").header("X-Admin-Api-Key", KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));
  }

  @Test
  void setupTimeoutMapsToGatewayTimeout() throws Exception {
    ServerEntity server = servers.save(new ServerEntity("198.51.100.31", 22, "root", "pw", 10, true, Instant.now()));
    doThrow(new ProvisioningException(ProvisioningError.SETUP_TIMEOUT, "setup of server timed out"))
        .when(engine).setupServer(any());

    mvc.perform(post("/api/v1/admin/servers/" + server.getId() + "/setup").header("X-Admin-Api-Key", KEY))
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.reason").value("setup_timeout"))
        .andExpect(jsonPath("$.message").value("setup of server timed out"));
  }

  @Test
  void inspectionSyncsOccupancy() throws Exception {
    ServerEntity server = servers.save(new ServerEntity("198.51.100.32", 22, "root", "pw", 10, true, Instant.now()));
    when(engine.inspectServer(any())).thenReturn(new ServerInspection(server.getId(), true, true, 4));

    mvc.perform(get("/api/v1/admin/servers/" + server.getId() + "/inspection").header("X-Admin-Api-Key", KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.peerCount").value(4))
        .andExpect(jsonPath("$.wireguardInstalled").value(true));

    assertThat(servers.findById(server.getId())).get().extracting(ServerEntity::getCurrentClients).isEqualTo(4);
  }

  @Test
  void unknownServerIsNotFound() throws Exception {
    mvc.perform(get("/api/v1/admin/servers/777777/inspection").header("X-Admin-Api-Key", KEY))
        .andExpect(status().isNotFound());
  }
}
