package com.boardwatch.watch.delivery;

import java.io.IOException;

public interface NotificationSender {

    /**
     * Sends one message.
     *
     * @throws IOException when the endpoint could not be reached or answered with a transient
     *     status (timeouts, 408, 429, 5xx)
     */
    SendAcknowledgement send(String botToken, String chatId, String text) throws IOException;
}
