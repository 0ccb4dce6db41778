package ch.so.arp.explorer.search;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the image collection feed into catalog items. The feed follows the
 * NASA image library layout: {@code collection.items[]} where each item holds
 * a {@code data} array (only the first element is used) and a {@code links}
 * array.
 */
class CatalogFeedReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogFeedReader.class);

    static final String DEFAULT_TYPE = "unknown";
    static final String DEFAULT_STATUS = "Active";
    private static final String IMAGE_RENDER = "image";

    private final ObjectMapper objectMapper;

    CatalogFeedReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    List<CatalogItem> read(Path feedPath) throws IOException {
        try (InputStream in = Files.newInputStream(feedPath)) {
            return read(in);
        }
    }

    List<CatalogItem> read(InputStream in) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        if (root == null) {
            throw new IOException("Feed is empty");
        }
        JsonNode feedItems = root.path("collection").path("items");
        List<CatalogItem> items = new ArrayList<>();
        int id = 0;
        for (JsonNode feedItem : feedItems) {
            id++;
            items.add(toCatalogItem(id, feedItem));
        }
        LOGGER.debug("Parsed {} feed items", items.size());
        return items;
    }

    private CatalogItem toCatalogItem(int id, JsonNode feedItem) {
        JsonNode data = feedItem.path("data").path(0);
        return new CatalogItem(
                id,
                text(data, "title", "Item " + id),
                text(data, "media_type", DEFAULT_TYPE),
                text(data, "date_created", ""),
                text(data, "description", ""),
                findImageUrl(feedItem.path("links")),
                DEFAULT_STATUS);
    }

    private String findImageUrl(JsonNode links) {
        for (JsonNode link : links) {
            if (IMAGE_RENDER.equals(link.path("render").asText(null))) {
                return link.path("href").asText(null);
            }
        }
        return null;
    }

    private String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        return value.asText();
    }
}
