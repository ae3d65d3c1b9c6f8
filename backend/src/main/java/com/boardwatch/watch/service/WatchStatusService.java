package com.boardwatch.watch.service;

import com.boardwatch.config.WatchProperties;
import com.boardwatch.watch.model.ConfigurationView;
import com.boardwatch.watch.model.ExecutionRecord;
import com.boardwatch.watch.model.ScheduleDescriptor;
import com.boardwatch.watch.model.StatusResponse;
import com.boardwatch.watch.model.WatchConfiguration;
import com.boardwatch.watch.persistence.WatchJdbcRepository;
import com.boardwatch.watch.schedule.ScheduleEvaluator;
import com.boardwatch.watch.secret.SecretProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class WatchStatusService {
    private static final Logger log = LoggerFactory.getLogger(WatchStatusService.class);
    private static final int DEFAULT_HISTORY_LIMIT = 20;
    private static final int MAX_HISTORY_LIMIT = 100;

    private final WatchJdbcRepository repository;
    private final ScheduleEvaluator scheduleEvaluator;
    private final SecretProvider secretProvider;
    private final WatchProperties properties;
    private final Clock clock;

    public WatchStatusService(
        WatchJdbcRepository repository,
        ScheduleEvaluator scheduleEvaluator,
        SecretProvider secretProvider,
        WatchProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.scheduleEvaluator = scheduleEvaluator;
        this.secretProvider = secretProvider;
        this.properties = properties;
        this.clock = clock;
    }

    public StatusResponse getStatus() {
        boolean secretAccessible = secretProvider.isAccessible(properties.getSecrets().getBotTokenName());
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database connectivity check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            return new StatusResponse(false, secretAccessible, new LinkedHashMap<>(), null);
        }
        Map<String, Long> counts = repository.tableCounts();
        ExecutionRecord latest = repository.findMostRecentExecution();
        return new StatusResponse(true, secretAccessible, counts, latest);
    }

    public List<ConfigurationView> listConfigurations() {
        Instant now = Instant.now(clock);
        return repository.findAllConfigurations().stream()
            .map(config -> toView(config, now))
            .toList();
    }

    public ConfigurationView getConfiguration(String configurationId) {
        return toView(requireConfiguration(configurationId), Instant.now(clock));
    }

    public List<ExecutionRecord> getExecutionHistory(String configurationId, Integer limit) {
        requireConfiguration(configurationId);
        int safeLimit = limit == null ? DEFAULT_HISTORY_LIMIT : Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        return repository.findExecutionRecords(configurationId, safeLimit);
    }

    private WatchConfiguration requireConfiguration(String configurationId) {
        WatchConfiguration config = repository.findConfiguration(configurationId);
        if (config == null) {
            throw new ConfigurationNotFoundException(configurationId);
        }
        return config;
    }

    private ConfigurationView toView(WatchConfiguration config, Instant now) {
        ScheduleDescriptor schedule = config.schedule();
        String scheduleTime = schedule instanceof ScheduleDescriptor.Daily daily ? daily.timeOfDay() : null;
        Integer interval = schedule instanceof ScheduleDescriptor.Custom custom ? custom.intervalMinutes() : null;
        Instant nextExecutionAt = config.active()
            ? scheduleEvaluator.nextExecutionAt(config, now).orElse(null)
            : null;
        return new ConfigurationView(
            config.id(),
            config.name(),
            config.boardId(),
            config.postCount(),
            config.keywords(),
            config.chatId(),
            schedule == null ? null : schedule.type(),
            scheduleTime,
            interval,
            config.active(),
            config.lastExecutedAt(),
            config.lastExecutionStatus(),
            config.lastExecutionMessage(),
            nextExecutionAt
        );
    }
}
