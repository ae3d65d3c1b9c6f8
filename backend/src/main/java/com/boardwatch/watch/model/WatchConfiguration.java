package com.boardwatch.watch.model;

import java.time.Instant;
import java.util.List;

public record WatchConfiguration(
    String id,
    String name,
    String boardId,
    int postCount,
    List<String> keywords,
    String chatId,
    ScheduleDescriptor schedule,
    boolean active,
    Instant lastExecutedAt,
    ExecutionStatus lastExecutionStatus,
    String lastExecutionMessage,
    Instant createdAt,
    Instant updatedAt
) {
    public WatchConfiguration {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public String displayName() {
        return name == null || name.isBlank() ? "Unknown" : name;
    }
}
