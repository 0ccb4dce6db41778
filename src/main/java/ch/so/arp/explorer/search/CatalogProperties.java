package ch.so.arp.explorer.search;

import java.nio.file.Path;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Locations of the catalog feed and of the embedding cache derived from it.
 */
@ConfigurationProperties(prefix = "explorer.catalog")
public class CatalogProperties {

    /**
     * JSON feed the catalog is built from.
     */
    private Path feedPath = Path.of("data", "mock_data.json");

    /**
     * Binary file holding the image embeddings of the feed.
     */
    private Path cachePath = Path.of("data", "embeddings_cache.bin");

    public Path getFeedPath() {
        return feedPath;
    }

    public void setFeedPath(Path feedPath) {
        this.feedPath = feedPath;
    }

    public Path getCachePath() {
        return cachePath;
    }

    public void setCachePath(Path cachePath) {
        this.cachePath = cachePath;
    }
}
