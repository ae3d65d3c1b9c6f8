package com.boardwatch.watch.service;

public class SystemicException extends RuntimeException {
    public SystemicException(String message) {
        super(message);
    }

    public SystemicException(String message, Throwable cause) {
        super(message, cause);
    }
}
