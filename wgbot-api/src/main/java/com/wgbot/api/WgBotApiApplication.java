package com.wgbot.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.wgbot")
@EnableJpaRepositories(basePackages = "com.wgbot")
@EntityScan(basePackages = "com.wgbot")
@ConfigurationPropertiesScan(basePackages = "com.wgbot")
public class WgBotApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(WgBotApiApplication.class, args);
  }
}
