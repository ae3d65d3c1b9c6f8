package com.boardwatch.watch.service;

import com.boardwatch.watch.model.ExecutionRecord;
import com.boardwatch.watch.model.ExecutionStatus;
import com.boardwatch.watch.persistence.WatchJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
public class ExecutionRecorder {
    private static final Logger log = LoggerFactory.getLogger(ExecutionRecorder.class);

    private final WatchJdbcRepository repository;
    private final Clock clock;

    public ExecutionRecorder(WatchJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public ExecutionRecord record(
        String configurationId,
        ExecutionStatus status,
        int articlesFound,
        int articlesSent,
        Duration duration,
        String errorMessage
    ) {
        Instant executedAt = Instant.now(clock);
        try {
            int updated = repository.updateLastExecution(configurationId, executedAt, status, errorMessage);
            if (updated == 0) {
                log.warn("Configuration {} vanished before its status could be updated", configurationId);
            } else {
                log.info("Updated configuration {} status to {}", configurationId, status.wireValue());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to update status of configuration {}", configurationId, e);
        }

        ExecutionRecord record = new ExecutionRecord(
            null,
            configurationId,
            executedAt,
            status,
            articlesFound,
            articlesSent,
            duration,
            errorMessage
        );
        try {
            long id = repository.insertExecutionRecord(record);
            log.info("Created execution record {} for configuration {}", id, configurationId);
            return new ExecutionRecord(
                id,
                configurationId,
                executedAt,
                status,
                articlesFound,
                articlesSent,
                duration,
                errorMessage
            );
        } catch (RuntimeException e) {
            log.warn("Failed to create execution record for configuration {}", configurationId, e);
            return record;
        }
    }
}
