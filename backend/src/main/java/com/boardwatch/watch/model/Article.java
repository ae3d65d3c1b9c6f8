package com.boardwatch.watch.model;

public record Article(
    String title,
    String author,
    String dateLabel,
    String link,
    String boardId
) {}
