package ch.so.arp.explorer.search;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ItemCatalog} holding all items in memory. Instances are immutable.
 */
class InMemoryItemCatalog implements ItemCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryItemCatalog.class);

    private final List<EmbeddedItem> entries;
    private final List<CatalogItem> items;
    private final Map<Integer, CatalogItem> itemsById;

    InMemoryItemCatalog(List<EmbeddedItem> entries) {
        Objects.requireNonNull(entries, "entries");
        this.entries = entries.stream()
                .sorted(Comparator.comparingInt(entry -> entry.item().id()))
                .toList();
        this.items = this.entries.stream().map(EmbeddedItem::item).toList();
        Map<Integer, CatalogItem> byId = new HashMap<>();
        for (CatalogItem item : items) {
            if (byId.putIfAbsent(item.id(), item) != null) {
                throw new IllegalArgumentException("Duplicate catalog id " + item.id());
            }
        }
        this.itemsById = Map.copyOf(byId);
    }

    @Override
    public List<CatalogItem> getAll() {
        LOGGER.debug("Listing {} catalog items", items.size());
        return items;
    }

    @Override
    public Map<Integer, CatalogItem> getByIds(Set<Integer> ids) {
        Map<Integer, CatalogItem> found = new HashMap<>();
        for (Integer id : ids) {
            CatalogItem item = itemsById.get(id);
            if (item != null) {
                found.put(id, item);
            }
        }
        return found;
    }

    @Override
    public List<EmbeddedItem> getAllWithEmbedding() {
        return entries;
    }

    long embeddedCount() {
        return entries.stream().filter(EmbeddedItem::hasEmbedding).count();
    }
}
