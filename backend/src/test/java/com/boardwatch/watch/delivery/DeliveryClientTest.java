package com.boardwatch.watch.delivery;

import com.boardwatch.config.WatchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeliveryClientTest {

    @Mock
    private NotificationSender sender;

    private final List<Duration> sleeps = new ArrayList<>();
    private WatchProperties properties;

    @BeforeEach
    void setUp() {
        properties = new WatchProperties();
        properties.getDelivery().setMaxAttempts(3);
        properties.getDelivery().setBaseDelayMs(1000);
        properties.getDelivery().setMaxDelayMs(10000);
        properties.getDelivery().setPacingDelayMs(1000);
    }

    @Test
    void transportFailureIsRetriedThenDelivered() throws Exception {
        when(sender.send("token", "chat", "hello"))
            .thenThrow(new IOException("connection reset"))
            .thenReturn(new SendAcknowledgement(true, 200, null));

        client().deliver("token", "chat", List.of("hello"));

        verify(sender, times(2)).send("token", "chat", "hello");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    void rejectionIsNotRetried() throws Exception {
        when(sender.send(anyString(), anyString(), anyString()))
            .thenReturn(new SendAcknowledgement(false, 400, "Bad Request: can't parse entities"));

        assertThatThrownBy(() -> client().deliver("token", "chat", List.of("one", "two")))
            .isInstanceOf(DeliveryException.class)
            .hasMessageContaining("can't parse entities")
            .satisfies(e -> assertThat(((DeliveryException) e).isRetryable()).isFalse());

        verify(sender, times(1)).send("token", "chat", "one");
        verify(sender, never()).send("token", "chat", "two");
        assertThat(sleeps).isEmpty();
    }

    @Test
    void exhaustedRetriesAbortRemainingMessages() throws Exception {
        when(sender.send("token", "chat", "one")).thenReturn(new SendAcknowledgement(true, 200, null));
        when(sender.send("token", "chat", "two")).thenThrow(new IOException("timeout"));

        assertThatThrownBy(() -> client().deliver("token", "chat", List.of("one", "two", "three")))
            .isInstanceOf(DeliveryException.class)
            .satisfies(e -> assertThat(((DeliveryException) e).isRetryable()).isTrue());

        verify(sender, times(1)).send("token", "chat", "one");
        verify(sender, times(3)).send("token", "chat", "two");
        verify(sender, never()).send("token", "chat", "three");
        // pacing after "one", then two backoffs for "two"
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void pacingOnlyBetweenMessages() throws Exception {
        when(sender.send(eq("token"), eq("chat"), anyString())).thenReturn(new SendAcknowledgement(true, 200, null));

        client().deliver("token", "chat", List.of("a", "b", "c"));

        verify(sender).send("token", "chat", "a");
        verify(sender).send("token", "chat", "b");
        verify(sender).send("token", "chat", "c");
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void backoffIsExponentialAndCapped() {
        DeliveryClient client = client();

        assertThat(client.backoff(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(client.backoff(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(client.backoff(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(client.backoff(5)).isEqualTo(Duration.ofSeconds(10));
    }

    private DeliveryClient client() {
        return new DeliveryClient(sender, properties, sleeps::add);
    }
}
