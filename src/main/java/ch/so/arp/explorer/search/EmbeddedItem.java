package ch.so.arp.explorer.search;

import java.util.Arrays;
import java.util.Objects;

/**
 * Pairs a catalog item with its embedding. The embedding is {@code null} when
 * it could not be produced; such items are listed but never ranked. The vector
 * is copied on the way in and on the way out.
 */
public record EmbeddedItem(CatalogItem item, float[] embedding) {

    public EmbeddedItem {
        Objects.requireNonNull(item, "item");
        embedding = embedding == null ? null : embedding.clone();
    }

    @Override
    public float[] embedding() {
        return embedding == null ? null : embedding.clone();
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof EmbeddedItem that)) {
            return false;
        }
        return item.equals(that.item) && Arrays.equals(embedding, that.embedding);
    }

    @Override
    public int hashCode() {
        return 31 * item.hashCode() + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "EmbeddedItem[item=" + item + ", dimensions=" + (embedding == null ? 0 : embedding.length) + "]";
    }
}
