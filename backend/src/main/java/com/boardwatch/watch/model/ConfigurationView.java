package com.boardwatch.watch.model;

import java.time.Instant;
import java.util.List;

public record ConfigurationView(
    String id,
    String name,
    String boardId,
    int postCount,
    List<String> keywords,
    String chatId,
    String scheduleType,
    String scheduleTime,
    Integer scheduleIntervalMinutes,
    boolean active,
    Instant lastExecutedAt,
    ExecutionStatus lastExecutionStatus,
    String lastExecutionMessage,
    Instant nextExecutionAt
) {}
