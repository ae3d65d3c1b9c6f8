package com.boardwatch.watch.model;

import java.time.Duration;
import java.time.Instant;

public record ExecutionRecord(
    Long id,
    String configurationId,
    Instant executedAt,
    ExecutionStatus status,
    int articlesFound,
    int articlesSent,
    Duration executionDuration,
    String errorMessage
) {}
