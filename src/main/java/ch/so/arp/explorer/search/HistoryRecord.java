package ch.so.arp.explorer.search;

import java.util.List;
import java.util.Objects;

/**
 * Stored trace of one search: the query as submitted, the UTC time it was run
 * (ISO-8601, second precision) and the ranked results as item references, in
 * the order they were returned.
 */
public record HistoryRecord(String id, String query, String timeSearched, List<HistoryEntry> entries) {

    public HistoryRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(timeSearched, "timeSearched");
        entries = List.copyOf(entries);
    }
}
