package com.boardwatch.watch.api;

import com.boardwatch.config.WatchProperties;
import com.boardwatch.watch.board.BoardFetchResult;
import com.boardwatch.watch.board.BoardFetcher;
import com.boardwatch.watch.model.BoardPreviewResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/boards")
public class BoardPreviewController {
    private final BoardFetcher boardFetcher;
    private final WatchProperties properties;

    public BoardPreviewController(BoardFetcher boardFetcher, WatchProperties properties) {
        this.boardFetcher = boardFetcher;
        this.properties = properties;
    }

    @GetMapping("/{board}/preview")
    public BoardPreviewResponse preview(
        @PathVariable("board") String board,
        @RequestParam(name = "count", required = false) Integer count,
        @RequestParam(name = "keywords", required = false) String keywords
    ) {
        int requested = count == null ? properties.getJobs().getDefaultPostCount() : count;
        List<String> keywordList = keywords == null
            ? List.of()
            : Arrays.stream(keywords.split(","))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .toList();
        BoardFetchResult result = boardFetcher.fetch(board, requested, keywordList);
        return new BoardPreviewResponse(
            board,
            requested,
            keywordList,
            result.articles().size(),
            result.articles(),
            result.partialFailure()
        );
    }
}
