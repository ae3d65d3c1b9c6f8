package com.boardwatch.watch.board;

import com.boardwatch.watch.model.Article;

import java.util.List;

public record BoardFetchResult(List<Article> articles, String partialFailure) {
    public BoardFetchResult {
        articles = articles == null ? List.of() : List.copyOf(articles);
    }

    public boolean isPartial() {
        return partialFailure != null;
    }
}
