package ch.so.arp.explorer.search;

/**
 * Compact reference to one ranked result of a past query.
 */
public record HistoryEntry(int itemId, double confidence) {
}
