package com.boardwatch.watch.model;

import java.util.List;

public record BoardPreviewResponse(
    String boardId,
    int requestedCount,
    List<String> keywords,
    int articlesFound,
    List<Article> articles,
    String partialFailure) {}
