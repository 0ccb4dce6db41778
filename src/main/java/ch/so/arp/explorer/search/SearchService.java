package ch.so.arp.explorer.search;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordinates a search: embeds the query, ranks the catalog against it and
 * records the outcome in the history.
 */
public class SearchService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SearchService.class);

    private final EmbeddingProvider embeddingProvider;
    private final ItemCatalog catalog;
    private final SimilarityRanker ranker;
    private final HistoryStore historyStore;

    public SearchService(EmbeddingProvider embeddingProvider, ItemCatalog catalog, SimilarityRanker ranker,
            HistoryStore historyStore) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.ranker = Objects.requireNonNull(ranker, "ranker");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore");
    }

    /**
     * Search the catalog. Blank queries yield no results and are not recorded.
     *
     * @param query         natural language query
     * @param limit         maximum number of results, at least 1
     * @param saveToHistory whether a non-empty outcome is recorded
     * @return the results, most confident first
     */
    public List<SearchResult> search(String query, int limit, boolean saveToHistory) {
        if (query == null || query.isBlank()) {
            LOGGER.info("Empty search query provided, returning empty results");
            return List.of();
        }
        String queryText = query.strip();
        LOGGER.info("Searching for '{}' with limit {}", queryText, limit);

        float[] queryEmbedding;
        try {
            queryEmbedding = embeddingProvider.embed(queryText);
        } catch (EmbeddingException ex) {
            LOGGER.error("Failed to generate embedding for query '{}': {}", queryText, ex.getMessage(), ex);
            return List.of();
        }

        List<SearchResult> results = ranker.rank(queryEmbedding, catalog.getAllWithEmbedding(), limit);
        LOGGER.info("Found {} results for '{}'", results.size(), queryText);
        if (saveToHistory && !results.isEmpty()) {
            historyStore.add(query, results);
        }
        return results;
    }

    public List<CatalogItem> listSources() {
        return catalog.getAll();
    }

    public HistoryPage listHistory(int startIndex, int limit) {
        return historyStore.list(startIndex, limit);
    }

    public List<SearchResult> getHistoryResults(String historyId) {
        return historyStore.getFullResults(historyId);
    }

    public boolean deleteHistory(String historyId) {
        return historyStore.delete(historyId);
    }
}
