package com.boardwatch.watch.service;

import com.boardwatch.config.WatchProperties;
import com.boardwatch.watch.model.SchedulerRunResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Service
public class WatchDaemonService {
    private static final Logger log = LoggerFactory.getLogger(WatchDaemonService.class);

    private final WatchJobRunner jobRunner;
    private final WatchProperties properties;
    private final ScheduledExecutorService executor;
    private final Object lifecycleLock = new Object();

    private ScheduledFuture<?> pollTask;

    public WatchDaemonService(
        WatchJobRunner jobRunner,
        WatchProperties properties,
        @Qualifier("watchDaemonExecutor") ScheduledExecutorService executor
    ) {
        this.jobRunner = jobRunner;
        this.properties = properties;
        this.executor = executor;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getDaemon().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return pollTask != null && !pollTask.isDone();
        }
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (pollTask != null && !pollTask.isDone()) {
                return;
            }
            long interval = properties.getDaemon().getPollIntervalSeconds();
            pollTask = executor.scheduleWithFixedDelay(this::pollOnce, 0, interval, TimeUnit.SECONDS);
            log.info("Watch daemon started, polling every {}s", interval);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (pollTask == null) {
                return;
            }
            pollTask.cancel(false);
            pollTask = null;
            log.info("Watch daemon stopped");
        }
    }

    void pollOnce() {
        try {
            SchedulerRunResponse response = jobRunner.run();
            if (!response.success()) {
                log.warn("Daemon poll failed: {}", response.error());
            }
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the fixed-delay schedule
            log.warn("Daemon poll threw unexpectedly", e);
        }
    }
}
