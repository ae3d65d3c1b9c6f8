package com.boardwatch.watch.board;

public class FetchException extends RuntimeException {
    private final String boardId;
    private final boolean retryable;

    public FetchException(String boardId, String message, boolean retryable) {
        super(message);
        this.boardId = boardId;
        this.retryable = retryable;
    }

    public FetchException(String boardId, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.boardId = boardId;
        this.retryable = retryable;
    }

    public String getBoardId() {
        return boardId;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
