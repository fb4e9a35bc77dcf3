package com.wgbot.api;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfigFilesGuardTest {

    @Test
    void secretsMustComeFromEnvironment() throws Exception {
        var content = Files.readString(Path.of("src/main/resources/application.yml"), StandardCharsets.UTF_8);

        assertThat(content)
                .contains("password: ${WGBOT_DB_PASSWORD:}")
                .contains("bot-token: ${WGBOT_TELEGRAM_BOT_TOKEN:}")
                .contains("api-keys: ${WGBOT_ADMIN_API_KEYS:}");
    }

    @Test
    void logPatternCarriesCorrelationIds() throws Exception {
        var content = Files.readString(Path.of("src/main/resources/logback-spring.xml"), StandardCharsets.UTF_8);

        assertThat(content).contains("%X{requestId").contains("%X{sweepId");
    }
}
