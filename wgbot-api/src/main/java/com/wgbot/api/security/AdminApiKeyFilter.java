package com.wgbot.api.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates admin requests by the X-Admin-Api-Key header against the configured keys.
 * A matching key yields ROLE_ADMIN with the masked key as principal (used as audit actor).
 */
public class AdminApiKeyFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(AdminApiKeyFilter.class);

  public static final String ADMIN_ACTOR_ATTR = "adminActor";

  private final String apiKeyHeader;
  private final List<String> adminApiKeys;

  public AdminApiKeyFilter(String apiKeyHeader, List<String> adminApiKeys) {
    this.apiKeyHeader = apiKeyHeader;
    this.adminApiKeys = List.copyOf(adminApiKeys);

    if (this.adminApiKeys.isEmpty()) {
      log.warn("No admin API keys configured (wgbot.admin.api-keys), admin endpoints will be inaccessible");
    } else {
      log.info("Admin API key filter configured with {} keys", this.adminApiKeys.size());
    }
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    if (adminApiKeys.isEmpty()) {
      unauthorized(response, "Admin API not configured");
      return;
    }

    String providedKey = request.getHeader(apiKeyHeader);
    if (providedKey == null || providedKey.isBlank()) {
      unauthorized(response, "Missing " + apiKeyHeader + " header");
      return;
    }

    if (!matches(providedKey.trim())) {
      log.warn("Invalid admin API key from {}", request.getRemoteAddr());
      unauthorized(response, "Invalid admin API key");
      return;
    }

    String actor = "admin:" + maskKey(providedKey.trim());
    request.setAttribute(ADMIN_ACTOR_ATTR, actor);

    SecurityContext context = SecurityContextHolder.createEmptyContext();
    context.setAuthentication(new UsernamePasswordAuthenticationToken(
        actor, null, List.of(new SimpleGrantedAuthority("ROLE_ADMIN"))));
    SecurityContextHolder.setContext(context);

    log.debug("Admin request authenticated: {} {} {}", actor, request.getMethod(), request.getRequestURI());
    filterChain.doFilter(request, response);
  }

  private boolean matches(String providedKey) {
    byte[] provided = providedKey.getBytes(StandardCharsets.UTF_8);
    boolean found = false;
    for (String key : adminApiKeys) {
      found |= MessageDigest.isEqual(provided, key.getBytes(StandardCharsets.UTF_8));
    }
    return found;
  }

  private static void unauthorized(HttpServletResponse response, String message) throws IOException {
    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.getWriter().write(String.format(
        "{\"status\":\"error\",\"reason\":\"unauthorized\",\"message\":\"%s\"}", message));
  }

  /**
   * First 8 characters only, for logs and audit.
   */
  static String maskKey(String key) {
    if (key == null || key.length() < 8) {
      return "****";
    }
    return key.substring(0, 8) + "...";
  }
}
