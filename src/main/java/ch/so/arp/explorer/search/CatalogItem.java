package ch.so.arp.explorer.search;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable catalog entry describing one image of the feed. Identifiers are
 * assigned sequentially (starting at 1) when the catalog is built.
 */
public record CatalogItem(
        int id,
        String name,
        String type,
        @JsonProperty("launch_date") String launchDate,
        String description,
        @JsonProperty("image_url") String imageUrl,
        String status) {
}
