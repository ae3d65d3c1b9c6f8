package com.boardwatch.watch.board;

import com.boardwatch.watch.model.Article;

record ListingEntry(String title, String author, String dateLabel, String link) {

    boolean isComplete() {
        return title != null && !title.isBlank() && link != null && !link.isBlank();
    }

    Article toArticle(String boardId) {
        return new Article(title, author, dateLabel, link, boardId);
    }
}
