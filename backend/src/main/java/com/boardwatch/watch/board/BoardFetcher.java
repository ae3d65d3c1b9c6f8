package com.boardwatch.watch.board;

import com.boardwatch.config.WatchProperties;
import com.boardwatch.watch.http.PoliteHttpClient;
import com.boardwatch.watch.model.Article;
import com.boardwatch.watch.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class BoardFetcher {
    private static final Logger log = LoggerFactory.getLogger(BoardFetcher.class);
    static final int MIN_POST_COUNT = 1;
    static final int MAX_POST_COUNT = 100;
    private static final int MAX_CONSENT_SUBMISSIONS = 1;
    private static final int OVER_READ_FACTOR = 2;

    private final PoliteHttpClient httpClient;
    private final BoardListingParser parser;
    private final WatchProperties.Board properties;

    public BoardFetcher(PoliteHttpClient httpClient, BoardListingParser parser, WatchProperties properties) {
        this.httpClient = httpClient;
        this.parser = parser;
        this.properties = properties.getBoard();
    }

    public BoardFetchResult fetch(String boardId, int desiredCount, List<String> keywords) {
        if (boardId == null || boardId.isBlank()) {
            throw new FetchException(boardId, "Board name is required", false);
        }
        if (desiredCount < MIN_POST_COUNT || desiredCount > MAX_POST_COUNT) {
            throw new FetchException(boardId, "Post count must be between 1 and 100, got " + desiredCount, false);
        }
        String board = boardId.trim();
        List<String> needles = normalizeKeywords(keywords);
        int budget = desiredCount * OVER_READ_FACTOR;

        List<Article> matches = new ArrayList<>();
        AtomicInteger consentSubmissions = new AtomicInteger();
        String partialFailure = null;
        int scanned = 0;
        int skipped = 0;
        int pages = 0;
        String pageUrl = boardIndexUrl(board);
        while (pageUrl != null && pages < properties.getMaxPages() && scanned < budget && matches.size() < desiredCount) {
            BoardListingPage page;
            try {
                page = loadPage(board, pageUrl, consentSubmissions);
            } catch (FetchException e) {
                if (pages == 0 || consentSubmissions.get() > MAX_CONSENT_SUBMISSIONS) {
                    throw e;
                }
                partialFailure = "Partial result: page " + (pages + 1) + " of board " + board + " failed: " + e.getMessage();
                log.warn("Stopping pagination of board {} at {}: {}", board, pageUrl, e.getMessage());
                break;
            }
            pages++;
            if (page.entries().isEmpty()) {
                break;
            }
            for (ListingEntry entry : page.entries()) {
                if (scanned >= budget || matches.size() >= desiredCount) {
                    break;
                }
                scanned++;
                if (!entry.isComplete()) {
                    skipped++;
                    continue;
                }
                if (matchesAny(entry.title(), needles)) {
                    matches.add(entry.toArticle(board));
                }
            }
            pageUrl = page.previousPageUrl();
        }

        log.info(
            "Scraped {} matching articles from board {} (pages={}, scanned={}, skipped={}, keywords={}, partial={})",
            matches.size(),
            board,
            pages,
            scanned,
            skipped,
            needles.size(),
            partialFailure != null
        );
        return new BoardFetchResult(matches, partialFailure);
    }

    // Consent is submitted at most once per fetch; a later gate pushes the counter past the limit.
    private BoardListingPage loadPage(String board, String pageUrl, AtomicInteger consentSubmissions) {
        while (true) {
            HttpFetchResult result = httpClient.get(pageUrl);
            ensureFetched(board, pageUrl, result);
            Document document;
            try {
                document = Jsoup.parse(result.body(), result.finalUrlOrRequested());
            } catch (RuntimeException e) {
                throw new FetchException(board, "Failed to parse listing of board " + board + ": " + e.getMessage(), false, e);
            }
            if (!isConsentGate(result, document)) {
                return parser.parse(document);
            }
            if (consentSubmissions.getAndIncrement() >= MAX_CONSENT_SUBMISSIONS) {
                throw new FetchException(board, "Consent gate still present for board " + board + " after accepting terms", false);
            }
            log.info("Consent gate on board {}, accepting terms", board);
            submitConsent(board, pageUrl, document);
        }
    }

    private void submitConsent(String board, String pageUrl, Document gate) {
        String returnPath = parser.consentReturnPath(gate, URI.create(pageUrl).getRawPath());
        String form = "from=" + URLEncoder.encode(returnPath, StandardCharsets.UTF_8) + "&yes=yes";
        HttpFetchResult result = httpClient.postForm(properties.getBaseUrl() + "/ask/over18", form, pageUrl);
        if (result.isTransportError() || result.statusCode() >= 400) {
            throw new FetchException(
                board,
                "Consent submission failed for board " + board + ": " + describe(result),
                result.isTransportError() || result.statusCode() >= 500
            );
        }
    }

    private boolean isConsentGate(HttpFetchResult result, Document document) {
        URI finalUri = result.finalUri();
        if (finalUri != null && finalUri.getPath() != null && finalUri.getPath().startsWith("/ask/over18")) {
            return true;
        }
        return parser.isConsentGate(document);
    }

    private void ensureFetched(String board, String url, HttpFetchResult result) {
        if (result.isSuccessful()) {
            return;
        }
        if (result.isTransportError()) {
            boolean retryable = !"invalid_url".equals(result.errorCode());
            throw new FetchException(board, "Failed to fetch " + url + ": " + describe(result), retryable);
        }
        int status = result.statusCode();
        if (status == 404) {
            throw new FetchException(board, "Board not found: " + board, false);
        }
        if (status == 403) {
            throw new FetchException(board, "Access forbidden for board " + board, false);
        }
        boolean retryable = status == 408 || status == 429 || status >= 500;
        throw new FetchException(board, "Failed to fetch " + url + ": " + describe(result), retryable);
    }

    private String boardIndexUrl(String board) {
        return properties.getBaseUrl() + "/bbs/" + URLEncoder.encode(board, StandardCharsets.UTF_8) + "/index.html";
    }

    private static List<String> normalizeKeywords(List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            out.add(keyword.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }

    private static boolean matchesAny(String title, List<String> needles) {
        if (needles.isEmpty()) {
            return true;
        }
        String haystack = title.toLowerCase(Locale.ROOT);
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static String describe(HttpFetchResult result) {
        if (result.errorCode() != null) {
            return result.errorCode() + (result.errorMessage() == null ? "" : " (" + result.errorMessage() + ")");
        }
        return "HTTP " + result.statusCode();
    }
}
