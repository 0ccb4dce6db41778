package ch.so.arp.explorer.search;

import java.util.List;

/**
 * One page of the search history. {@code total} counts every stored record,
 * independent of the requested window.
 */
public record HistoryPage(List<HistorySummary> items, int total) {
}
