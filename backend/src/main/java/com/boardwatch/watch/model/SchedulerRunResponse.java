package com.boardwatch.watch.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SchedulerRunResponse(
    boolean success,
    @JsonInclude(JsonInclude.Include.NON_NULL) String message,
    @JsonInclude(JsonInclude.Include.NON_NULL) String error,
    double executionTime,
    int configurationsEvaluated,
    int jobsSucceeded,
    int totalArticlesSent,
    List<JobResult> results
) {
    public SchedulerRunResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
