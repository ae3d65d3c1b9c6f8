package com.boardwatch.watch.board;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class BoardListingParser {
    static final String UNKNOWN = "Unknown";
    private static final String CONSENT_FORM = "form[action*=over18]";
    private static final String CONSENT_TEXT = "我同意，我已年滿十八歲";
    private static final String PREVIOUS_PAGE_TEXT = "上頁";

    boolean isConsentGate(Document document) {
        if (document == null) {
            return false;
        }
        if (document.selectFirst(CONSENT_FORM) != null) {
            return true;
        }
        return document.selectFirst("div.over18-notice") != null
            || document.body() != null && document.body().text().contains(CONSENT_TEXT);
    }

    String consentReturnPath(Document document, String fallbackPath) {
        if (document == null) {
            return fallbackPath;
        }
        Element from = document.selectFirst(CONSENT_FORM + " input[name=from]");
        if (from == null || from.val().isBlank()) {
            return fallbackPath;
        }
        return from.val().trim();
    }

    BoardListingPage parse(Document document) {
        List<ListingEntry> entries = new ArrayList<>();
        for (Element row : document.select("div.r-ent")) {
            Element link = row.selectFirst("div.title a");
            String title = link == null ? null : link.text().trim();
            String href = link == null ? null : link.absUrl("href");
            entries.add(new ListingEntry(
                title,
                textOrUnknown(row.selectFirst("div.author")),
                textOrUnknown(row.selectFirst("div.date")),
                href == null || href.isBlank() ? null : href
            ));
        }
        return new BoardListingPage(entries, previousPageUrl(document));
    }

    private String previousPageUrl(Document document) {
        for (Element button : document.select("div.btn-group-paging a")) {
            if (!button.text().contains(PREVIOUS_PAGE_TEXT)) {
                continue;
            }
            String href = button.absUrl("href");
            return href.isBlank() ? null : href;
        }
        return null;
    }

    private String textOrUnknown(Element element) {
        if (element == null) {
            return UNKNOWN;
        }
        String text = element.text().trim();
        return text.isEmpty() ? UNKNOWN : text;
    }
}
