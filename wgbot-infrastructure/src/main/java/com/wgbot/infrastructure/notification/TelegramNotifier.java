package com.wgbot.infrastructure.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wgbot.application.ports.NotificationException;
import com.wgbot.application.ports.NotifierPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Sends plain-text messages through the Telegram Bot API.
 * No parse_mode, so user-controlled text (names, plan titles) is never interpreted as markup.
 */
public class TelegramNotifier implements NotifierPort {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    public static final String DEFAULT_BASE_URL = "https://api.telegram.org";

    private final String botToken;
    private final String baseUrl;
    private final ObjectMapper mapper;

    private final OkHttpClient client = new OkHttpClient.Builder()
            .connectTimeout(30, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .writeTimeout(30, TimeUnit.SECONDS)
            .build();

    public TelegramNotifier(String botToken, String baseUrl, ObjectMapper mapper) {
        if (botToken == null || botToken.isBlank()) {
            throw new IllegalArgumentException("Telegram bot token is required");
        }
        this.botToken = botToken;
        this.baseUrl = stripTrailingSlash(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl);
        this.mapper = mapper;
    }

    @Override
    public void notify(long destinationId, String text) {
        ObjectNode body = mapper.createObjectNode();
        body.put("chat_id", destinationId);
        body.put("text", text);

        Request request = new Request.Builder()
                .url(baseUrl + "/bot" + botToken + "/sendMessage")
                .post(RequestBody.create(body.toString(), JSON))
                .build();

        try (Response resp = client.newCall(request).execute()) {
            ResponseBody rb = resp.body();
            String raw = rb == null ? "" : rb.string();
            if (!resp.isSuccessful()) {
                throw new NotificationException("Telegram sendMessage to " + destinationId
                        + " failed: HTTP " + resp.code() + " " + describe(raw));
            }
            log.debug("Telegram message delivered to {}", destinationId);
        } catch (IOException e) {
            throw new NotificationException("Telegram sendMessage to " + destinationId + " failed: " + e.getMessage(), e);
        }
    }

    private String describe(String raw) {
        if (raw == null || raw.isBlank()) return "";
        try {
            JsonNode node = mapper.readTree(raw);
            JsonNode description = node.get("description");
            return description == null ? raw : description.asText();
        } catch (IOException e) {
            return raw;
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
