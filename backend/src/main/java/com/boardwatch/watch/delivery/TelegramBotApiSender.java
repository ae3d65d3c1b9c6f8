package com.boardwatch.watch.delivery;

import com.boardwatch.config.WatchProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

@Component
public class TelegramBotApiSender implements NotificationSender {
    private final WatchProperties.Delivery properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public TelegramBotApiSender(WatchProperties properties, ObjectMapper objectMapper) {
        this.properties = properties.getDelivery();
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(this.properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public SendAcknowledgement send(String botToken, String chatId, String text) throws IOException {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("chat_id", chatId);
        payload.put("text", text);
        if (properties.getParseMode() != null && !properties.getParseMode().isBlank()) {
            payload.put("parse_mode", properties.getParseMode());
        }
        payload.put("disable_web_page_preview", properties.isDisableWebPagePreview());

        HttpRequest request = HttpRequest.newBuilder(URI.create(properties.getApiBaseUrl() + "/bot" + botToken + "/sendMessage"))
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload), StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while sending to Telegram", e);
        }

        int status = response.statusCode();
        if (status == 408 || status == 429 || status >= 500) {
            throw new IOException("Telegram API answered HTTP " + status);
        }
        JsonNode body = readBody(response.body());
        boolean ok = body != null && body.path("ok").asBoolean(false) && status >= 200 && status < 300;
        String description = body == null ? null : body.path("description").asText(null);
        if (!ok && description == null) {
            description = "HTTP " + status;
        }
        return new SendAcknowledgement(ok, status, description);
    }

    private JsonNode readBody(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
