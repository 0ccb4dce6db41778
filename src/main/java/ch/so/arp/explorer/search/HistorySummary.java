package ch.so.arp.explorer.search;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * History listing element: a past query with its three best results resolved
 * against the current catalog.
 */
public record HistorySummary(
        String id,
        String query,
        @JsonProperty("time_searched") String timeSearched,
        @JsonProperty("top_three_images") List<SearchResult> topThreeImages) {
}
