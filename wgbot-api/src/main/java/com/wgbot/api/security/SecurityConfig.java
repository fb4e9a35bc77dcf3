package com.wgbot.api.security;

import com.wgbot.api.config.WgBotProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

/**
 * Stateless security:
 * - health and error are public
 * - admin API and the remaining actuator endpoints require an admin API key
 * - everything else is denied
 */
@Configuration
public class SecurityConfig {

  @Bean
  @Order(1)
  SecurityFilterChain publicChain(HttpSecurity http) throws Exception {
    return http
        .securityMatcher("/actuator/health", "/actuator/health/**", "/actuator/info", "/error")
        .csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
        .build();
  }

  @Bean
  @Order(2)
  SecurityFilterChain adminChain(HttpSecurity http, WgBotProperties props) throws Exception {
    WgBotProperties.Admin admin = props.admin();
    return http
        .securityMatcher("/api/v1/admin/**", "/actuator/**")
        .csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(new AdminApiKeyFilter(admin.apiKeyHeader(), admin.apiKeys()), AnonymousAuthenticationFilter.class)
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
            .anyRequest().hasRole("ADMIN")
        )
        .build();
  }

  @Bean
  @Order(3)
  SecurityFilterChain denyAllChain(HttpSecurity http) throws Exception {
    return http
        .csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth.anyRequest().denyAll())
        .build();
  }
}
