package ch.so.arp.explorer.search;

import java.util.ArrayList;
import java.util.List;

final class CatalogFixtures {

    private CatalogFixtures() {
    }

    static CatalogItem item(int id) {
        return new CatalogItem(id, "Item " + id, "image", "2020-01-01T00:00:00Z", "Description " + id,
                "https://images.example/" + id + ".jpg", "Active");
    }

    /**
     * Two dimensional unit vector whose cosine similarity with {@code (1, 0)}
     * is {@code similarity}.
     */
    static float[] withSimilarity(double similarity) {
        return new float[] { (float) similarity, (float) Math.sqrt(1.0d - similarity * similarity) };
    }

    static InMemoryItemCatalog catalogOf(int... ids) {
        List<EmbeddedItem> entries = new ArrayList<>();
        for (int id : ids) {
            entries.add(new EmbeddedItem(item(id), withSimilarity(0.5d)));
        }
        return new InMemoryItemCatalog(entries);
    }

    static SearchResult result(int id, double confidence) {
        return SearchResult.of(item(id), confidence);
    }
}
