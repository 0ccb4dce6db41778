package ch.so.arp.explorer.search;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the in-memory catalog at startup: reads the feed, embeds every image
 * (reusing the embedding cache where it is still valid) and persists newly
 * computed embeddings in a single batch.
 */
class CatalogLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogLoader.class);

    private final CatalogFeedReader feedReader;
    private final EmbeddingProvider embeddingProvider;

    CatalogLoader(CatalogFeedReader feedReader, EmbeddingProvider embeddingProvider) {
        this.feedReader = Objects.requireNonNull(feedReader, "feedReader");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
    }

    InMemoryItemCatalog load(Path feedPath, Path cachePath) {
        List<CatalogItem> items;
        try {
            items = feedReader.read(feedPath);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read catalog feed " + feedPath, ex);
        }
        LOGGER.info("Processing {} catalog items from {}", items.size(), feedPath);

        EmbeddingCache cache = EmbeddingCache.open(cachePath, feedPath);
        List<EmbeddedItem> entries = new ArrayList<>(items.size());
        for (CatalogItem item : items) {
            entries.add(new EmbeddedItem(item, embed(cache, item)));
        }
        cache.flush();

        InMemoryItemCatalog catalog = new InMemoryItemCatalog(entries);
        LOGGER.info("Catalog initialized: {} items, {} with embeddings", catalog.getAll().size(),
                catalog.embeddedCount());
        return catalog;
    }

    private float[] embed(EmbeddingCache cache, CatalogItem item) {
        if (item.imageUrl() == null) {
            LOGGER.debug("Item {} has no image link and stays unembedded", item.id());
            return null;
        }
        try {
            return cache.getOrCompute(item.id(), () -> embeddingProvider.embedImage(item.imageUrl()));
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to embed image of item {} ({}): {}", item.id(), item.imageUrl(), ex.getMessage());
            return null;
        }
    }
}
