package ch.so.arp.explorer.search;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view on the fixed set of cataloged items. The catalog is built
 * once at startup and is safe for concurrent reads afterwards.
 */
public interface ItemCatalog {

    /**
     * List every item without embeddings.
     *
     * @return all items ordered by id ascending
     */
    List<CatalogItem> getAll();

    /**
     * Resolve a set of identifiers. Identifiers that are unknown to the catalog
     * are simply absent from the returned map.
     *
     * @param ids the identifiers to resolve
     * @return the items found, keyed by id
     */
    Map<Integer, CatalogItem> getByIds(Set<Integer> ids);

    /**
     * List every item together with its embedding, if any.
     *
     * @return all items ordered by id ascending
     */
    List<EmbeddedItem> getAllWithEmbedding();
}
