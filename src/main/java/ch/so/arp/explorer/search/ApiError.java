package ch.so.arp.explorer.search;

import java.time.Instant;

/** Structured API error response. */
public record ApiError(String errorId, String code, String message, String path, Instant timestamp) {

    public static final String HISTORY_NOT_FOUND = "HISTORY_001";
    public static final String VALIDATION_ERROR = "VALIDATION_001";
    public static final String INTERNAL_ERROR = "INTERNAL_001";
}
