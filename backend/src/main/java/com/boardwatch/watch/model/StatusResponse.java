package com.boardwatch.watch.model;

import java.util.Map;

public record StatusResponse(
    boolean dbConnectivity,
    boolean secretAccessible,
    Map<String, Long> counts,
    ExecutionRecord mostRecentExecution) {}
