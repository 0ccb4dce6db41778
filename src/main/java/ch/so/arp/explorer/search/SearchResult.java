package ch.so.arp.explorer.search;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Catalog item enriched with the confidence computed for one query. The
 * confidence is relative to the candidate pool of that query and lies within
 * {@code [0.2, 1.0]}.
 */
public record SearchResult(
        int id,
        String name,
        String type,
        @JsonProperty("launch_date") String launchDate,
        String description,
        @JsonProperty("image_url") String imageUrl,
        String status,
        double confidence) {

    public static SearchResult of(CatalogItem item, double confidence) {
        return new SearchResult(item.id(), item.name(), item.type(), item.launchDate(), item.description(),
                item.imageUrl(), item.status(), confidence);
    }
}
