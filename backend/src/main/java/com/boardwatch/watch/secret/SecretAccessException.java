package com.boardwatch.watch.secret;

import com.boardwatch.watch.service.SystemicException;

public class SecretAccessException extends SystemicException {
    public SecretAccessException(String message) {
        super(message);
    }

    public SecretAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
