package com.boardwatch.watch.delivery;

public record SendAcknowledgement(boolean ok, int statusCode, String description) {}
