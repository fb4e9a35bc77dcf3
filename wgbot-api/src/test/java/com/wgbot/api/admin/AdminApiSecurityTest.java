package com.wgbot.api.admin;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AdminApiSecurityTest {

  static final String KEY = "test-admin-key-0123456789";

  @Autowired MockMvc mvc;

  @Test
  void healthIsPublic() throws Exception {
    mvc.perform(get("/actuator/health"))
        .andExpect(status().isOk());
  }

  @Test
  void missingKeyIsRejected() throws Exception {
    mvc.perform(get("/api/v1/admin/subscriptions/1"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.reason").value("unauthorized"));
  }

  @Test
  void wrongKeyIsRejected() throws Exception {
    mvc.perform(post("/api/v1/admin/sweeps").header("X-Admin-Api-Key", "not-the-key"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.message").value("Invalid admin API key"));
  }

  @Test
  void validKeyReachesController() throws Exception {
    mvc.perform(get("/api/v1/admin/subscriptions/987654").header("X-Admin-Api-Key", KEY))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.reason").value("not_found"));
  }

  @Test
  void metricsNeedKey() throws Exception {
    mvc.perform(get("/actuator/metrics"))
        .andExpect(status().isUnauthorized());
    mvc.perform(get("/actuator/metrics/wgbot.sweep.runs").header("X-Admin-Api-Key", KEY))
        .andExpect(status().isOk());
  }

  @Test
  void unknownPathsAreDenied() throws Exception {
    mvc.perform(get("/internal/anything"))
        .andExpect(status().isForbidden());
  }
}
