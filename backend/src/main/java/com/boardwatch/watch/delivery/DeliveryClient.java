package com.boardwatch.watch.delivery;

import com.boardwatch.config.WatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

@Service
public class DeliveryClient {
    private static final Logger log = LoggerFactory.getLogger(DeliveryClient.class);

    private final NotificationSender sender;
    private final WatchProperties.Delivery properties;
    private final Sleeper sleeper;

    public DeliveryClient(NotificationSender sender, WatchProperties properties, Sleeper sleeper) {
        this.sender = sender;
        this.properties = properties.getDelivery();
        this.sleeper = sleeper;
    }

    public void deliver(String botToken, String destination, List<String> messages) {
        if (messages == null || messages.isEmpty()) {
            return;
        }
        for (int i = 0; i < messages.size(); i++) {
            sendWithRetry(botToken, destination, messages.get(i), i + 1, messages.size());
            log.info("Sent message {}/{} to chat {}", i + 1, messages.size(), destination);
            if (i < messages.size() - 1) {
                pause(Duration.ofMillis(properties.getPacingDelayMs()));
            }
        }
    }

    private void sendWithRetry(String botToken, String destination, String text, int index, int total) {
        int maxAttempts = properties.getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            SendAcknowledgement ack;
            try {
                ack = sender.send(botToken, destination, text);
            } catch (IOException e) {
                if (attempt >= maxAttempts) {
                    throw new DeliveryException(
                        "Failed to send message " + index + "/" + total + " after " + maxAttempts + " attempts: " + e.getMessage(),
                        true,
                        e
                    );
                }
                Duration delay = backoff(attempt);
                log.warn(
                    "Telegram request failed (attempt {}/{}) for chat {}, retrying in {} ms: {}",
                    attempt,
                    maxAttempts,
                    destination,
                    delay.toMillis(),
                    e.getMessage()
                );
                pause(delay);
                continue;
            }
            if (ack.ok()) {
                return;
            }
            throw new DeliveryException(
                "Telegram API rejected message " + index + "/" + total + ": " + ack.description(),
                false
            );
        }
    }

    Duration backoff(int attempt) {
        long base = properties.getBaseDelayMs();
        long delay = base * (1L << Math.max(0, Math.min(attempt - 1, 20)));
        int maxDelayMs = properties.getMaxDelayMs();
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        return Duration.ofMillis(Math.max(0, delay));
    }

    private void pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Interrupted while pacing delivery", false, e);
        }
    }
}
