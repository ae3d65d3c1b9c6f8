package com.boardwatch.watch.service;

import com.boardwatch.config.WatchProperties;
import com.boardwatch.watch.model.JobResult;
import com.boardwatch.watch.model.SchedulerRunResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class WatchCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(WatchCliRunner.class);

    private final WatchProperties properties;
    private final WatchJobRunner jobRunner;
    private final ConfigurableApplicationContext applicationContext;

    public WatchCliRunner(
        WatchProperties properties,
        WatchJobRunner jobRunner,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.jobRunner = jobRunner;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        SchedulerRunResponse response = jobRunner.run();
        if (response.success()) {
            log.info("Scheduler run completed: {}", response.message());
        } else {
            log.warn("Scheduler run failed: {}", response.error());
        }
        for (JobResult result : response.results()) {
            log.info(
                "Result {} ({}): status={}, found={}, sent={}, seconds={}, error={}",
                result.configName(),
                result.configId(),
                result.status().wireValue(),
                result.articlesFound(),
                result.articlesSent(),
                result.executionDuration(),
                result.errorMessage()
            );
        }

        if (properties.getCli().isExitAfterRun()) {
            int status = response.success() ? 0 : 1;
            int exitCode = SpringApplication.exit(applicationContext, () -> status);
            System.exit(exitCode);
        }
    }
}
