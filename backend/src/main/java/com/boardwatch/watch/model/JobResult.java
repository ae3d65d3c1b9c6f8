package com.boardwatch.watch.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobResult(
    String configId,
    String configName,
    ExecutionStatus status,
    int articlesFound,
    int articlesSent,
    double executionDuration,
    String errorMessage
) {}
