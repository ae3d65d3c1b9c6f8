package com.boardwatch.watch.board;

import java.util.List;

record BoardListingPage(List<ListingEntry> entries, String previousPageUrl) {
    BoardListingPage {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
