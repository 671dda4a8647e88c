package com.aitracker.dedup.exception;

import java.time.LocalDateTime;

/**
 * Stored article history could not be read.
 */
public class HistoryUnavailableException extends RuntimeException {

    private final String errorCode;

    public HistoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "HISTORY_UNAVAILABLE";
    }

    public HistoryUnavailableException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Window query against the article store failed
     */
    public static HistoryUnavailableException queryFailed(LocalDateTime cutoff, Throwable cause) {
        return new HistoryUnavailableException("HISTORY_QUERY_FAILED",
                "Failed to read stored articles since " + cutoff, cause);
    }

    public String getErrorCode() {
        return errorCode;
    }
}
