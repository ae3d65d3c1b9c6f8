package com.boardwatch.watch.service;

import com.boardwatch.config.WatchProperties;
import com.boardwatch.watch.board.BoardFetchResult;
import com.boardwatch.watch.board.BoardFetcher;
import com.boardwatch.watch.board.FetchException;
import com.boardwatch.watch.delivery.DeliveryClient;
import com.boardwatch.watch.delivery.DeliveryException;
import com.boardwatch.watch.delivery.MessageChunker;
import com.boardwatch.watch.model.Article;
import com.boardwatch.watch.model.ExecutionStatus;
import com.boardwatch.watch.model.JobResult;
import com.boardwatch.watch.model.SchedulerRunResponse;
import com.boardwatch.watch.model.WatchConfiguration;
import com.boardwatch.watch.persistence.WatchJdbcRepository;
import com.boardwatch.watch.schedule.ScheduleEvaluator;
import com.boardwatch.watch.secret.SecretProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class WatchJobRunner {
    private static final Logger log = LoggerFactory.getLogger(WatchJobRunner.class);

    private final WatchJdbcRepository repository;
    private final ScheduleEvaluator scheduleEvaluator;
    private final BoardFetcher boardFetcher;
    private final MessageChunker messageChunker;
    private final DeliveryClient deliveryClient;
    private final ExecutionRecorder executionRecorder;
    private final SecretProvider secretProvider;
    private final WatchProperties properties;
    private final Clock clock;

    public WatchJobRunner(
        WatchJdbcRepository repository,
        ScheduleEvaluator scheduleEvaluator,
        BoardFetcher boardFetcher,
        MessageChunker messageChunker,
        DeliveryClient deliveryClient,
        ExecutionRecorder executionRecorder,
        SecretProvider secretProvider,
        WatchProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.scheduleEvaluator = scheduleEvaluator;
        this.boardFetcher = boardFetcher;
        this.messageChunker = messageChunker;
        this.deliveryClient = deliveryClient;
        this.executionRecorder = executionRecorder;
        this.secretProvider = secretProvider;
        this.properties = properties;
        this.clock = clock;
    }

    public SchedulerRunResponse run() {
        Instant startedAt = Instant.now(clock);
        List<JobResult> results = new ArrayList<>();
        int evaluated = 0;
        log.info("Scheduler run started at {}", startedAt);
        try {
            String botToken = secretProvider.getSecret(properties.getSecrets().getBotTokenName());
            List<WatchConfiguration> configurations = loadActiveConfigurations();
            log.info("Found {} active configurations", configurations.size());
            if (configurations.isEmpty()) {
                return summarize(startedAt, true, "No active configurations found", null, 0, results);
            }

            Instant now = Instant.now(clock);
            List<WatchConfiguration> due = new ArrayList<>();
            for (WatchConfiguration config : configurations) {
                evaluated++;
                if (scheduleEvaluator.isDue(config, now)) {
                    log.info("Configuration '{}' ({}) is due", config.displayName(), config.id());
                    due.add(config);
                } else {
                    log.debug("Configuration '{}' ({}) is not due yet", config.displayName(), config.id());
                }
            }
            log.info("{} of {} configurations due for execution", due.size(), evaluated);

            for (WatchConfiguration config : due) {
                results.add(executeJob(config, botToken));
            }
            long succeeded = results.stream().filter(result -> result.status() == ExecutionStatus.SUCCESS).count();
            String message = "Executed " + results.size() + " jobs, " + succeeded + " successful";
            return summarize(startedAt, true, message, null, evaluated, results);
        } catch (SystemicException e) {
            log.warn("Scheduler run aborted: {}", e.getMessage(), e);
            return summarize(startedAt, false, null, e.getMessage(), evaluated, results);
        } catch (RuntimeException e) {
            log.warn("Scheduler run failed unexpectedly", e);
            return summarize(startedAt, false, null, describe(e), evaluated, results);
        }
    }

    JobResult executeJob(WatchConfiguration config, String botToken) {
        Instant startedAt = Instant.now(clock);
        ExecutionStatus status = ExecutionStatus.ERROR;
        int articlesFound = 0;
        int articlesSent = 0;
        String errorMessage = null;
        Duration duration = Duration.ZERO;
        log.info("Executing configuration '{}' ({}) on board {}", config.displayName(), config.id(), config.boardId());
        try {
            BoardFetchResult fetched = boardFetcher.fetch(config.boardId(), postCount(config), config.keywords());
            List<Article> articles = fetched.articles();
            articlesFound = articles.size();
            if (fetched.isPartial()) {
                errorMessage = fetched.partialFailure();
                log.warn("Configuration '{}' continues with a partial listing: {}", config.displayName(), errorMessage);
            }
            if (articlesFound == 0) {
                status = ExecutionStatus.NO_ARTICLES;
                log.info("No articles found for configuration '{}'", config.displayName());
            } else {
                List<String> messages = messageChunker.chunk(articles, config.boardId());
                deliveryClient.deliver(botToken, config.chatId(), messages);
                articlesSent = articlesFound;
                status = ExecutionStatus.SUCCESS;
                log.info(
                    "Sent {} articles in {} messages for configuration '{}'",
                    articlesSent,
                    messages.size(),
                    config.displayName()
                );
            }
        } catch (FetchException e) {
            errorMessage = "Board fetch error: " + e.getMessage();
            log.warn(
                "Board fetch of {} failed for '{}' (retryable={})",
                e.getBoardId(),
                config.displayName(),
                e.isRetryable(),
                e
            );
        } catch (DeliveryException e) {
            errorMessage = "Delivery error: " + e.getMessage();
            log.warn("Delivery failed for '{}' (retryable={})", config.displayName(), e.isRetryable(), e);
        } catch (RuntimeException e) {
            errorMessage = "Unexpected error: " + describe(e);
            log.warn("Unexpected failure in job for '{}'", config.displayName(), e);
        } finally {
            duration = Duration.between(startedAt, Instant.now(clock));
            executionRecorder.record(config.id(), status, articlesFound, articlesSent, duration, errorMessage);
        }
        return new JobResult(
            config.id(),
            config.displayName(),
            status,
            articlesFound,
            articlesSent,
            seconds(duration),
            errorMessage
        );
    }

    private List<WatchConfiguration> loadActiveConfigurations() {
        try {
            return repository.findActiveConfigurations();
        } catch (DataAccessException e) {
            throw new SystemicException("Failed to load active configurations: " + e.getMessage(), e);
        }
    }

    private int postCount(WatchConfiguration config) {
        return config.postCount() > 0 ? config.postCount() : properties.getJobs().getDefaultPostCount();
    }

    private SchedulerRunResponse summarize(
        Instant startedAt,
        boolean success,
        String message,
        String error,
        int evaluated,
        List<JobResult> results
    ) {
        Duration elapsed = Duration.between(startedAt, Instant.now(clock));
        int succeeded = 0;
        int articlesSent = 0;
        for (JobResult result : results) {
            if (result.status() == ExecutionStatus.SUCCESS) {
                succeeded++;
            }
            articlesSent += result.articlesSent();
        }
        log.info(
            "Scheduler run finished in {} ms: success={}, evaluated={}, jobs={}, succeeded={}, articlesSent={}",
            elapsed.toMillis(),
            success,
            evaluated,
            results.size(),
            succeeded,
            articlesSent
        );
        return new SchedulerRunResponse(
            success,
            message,
            error,
            seconds(elapsed),
            evaluated,
            succeeded,
            articlesSent,
            results
        );
    }

    private static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
