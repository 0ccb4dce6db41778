package ch.so.arp.explorer.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ranks catalog items against a query embedding. Raw cosine similarities are
 * min-max rescaled over the whole candidate pool into a confidence between
 * {@value #MIN_CONFIDENCE} and {@value #MAX_CONFIDENCE}; the pool is truncated
 * to the requested limit only afterwards. When all similarities tie, every
 * candidate receives {@value #TIE_CONFIDENCE}.
 */
public class SimilarityRanker {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimilarityRanker.class);

    static final double MIN_CONFIDENCE = 0.2d;
    static final double MAX_CONFIDENCE = 1.0d;
    static final double CONFIDENCE_SPAN = 0.8d;
    static final double TIE_CONFIDENCE = (MIN_CONFIDENCE + MAX_CONFIDENCE) / 2.0d;
    static final double TIE_EPSILON = 1.0e-4d;

    private static final Comparator<SearchResult> BY_CONFIDENCE = Comparator
            .comparingDouble(SearchResult::confidence).reversed()
            .thenComparingInt(SearchResult::id);

    /**
     * Rank the candidates against the query.
     *
     * @param queryEmbedding the embedding of the query
     * @param candidates     the catalog items with their embeddings
     * @param limit          the maximum number of results, at least 1
     * @return the best results, most confident first
     */
    public List<SearchResult> rank(float[] queryEmbedding, List<EmbeddedItem> candidates, int limit) {
        Objects.requireNonNull(queryEmbedding, "queryEmbedding");
        Objects.requireNonNull(candidates, "candidates");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        double[] unitQuery = Vectors.normalize(queryEmbedding);
        if (unitQuery == null) {
            LOGGER.warn("Query embedding has zero norm, nothing to rank");
            return List.of();
        }

        List<ScoredItem> scored = new ArrayList<>();
        for (EmbeddedItem candidate : candidates) {
            if (!candidate.hasEmbedding()) {
                continue;
            }
            OptionalDouble similarity = Vectors.cosineSimilarity(unitQuery, candidate.embedding());
            if (similarity.isPresent()) {
                scored.add(new ScoredItem(candidate.item(), similarity.getAsDouble()));
            } else {
                LOGGER.debug("Item {} has no comparable embedding", candidate.item().id());
            }
        }
        if (scored.isEmpty()) {
            return List.of();
        }

        List<SearchResult> results = toConfidence(scored).stream()
                .sorted(BY_CONFIDENCE)
                .limit(limit)
                .toList();
        LOGGER.debug("Ranked {} candidates, returning {}", scored.size(), results.size());
        return results;
    }

    /**
     * Rescale raw similarities into confidences, preserving the input order.
     */
    static List<SearchResult> toConfidence(List<ScoredItem> scored) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (ScoredItem item : scored) {
            min = Math.min(min, item.similarity());
            max = Math.max(max, item.similarity());
        }
        double range = max - min;
        List<SearchResult> results = new ArrayList<>(scored.size());
        for (ScoredItem item : scored) {
            double confidence;
            if (range < TIE_EPSILON) {
                confidence = TIE_CONFIDENCE;
            } else {
                confidence = MIN_CONFIDENCE + CONFIDENCE_SPAN * ((item.similarity() - min) / range);
            }
            results.add(SearchResult.of(item.item(), confidence));
        }
        return results;
    }

    record ScoredItem(CatalogItem item, double similarity) {
    }
}
