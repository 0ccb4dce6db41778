package ch.so.arp.explorer.search;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory search history. Each record keeps only item ids and confidences;
 * full results are rebuilt from the catalog when they are read, silently
 * dropping items the catalog no longer knows. Records are listed most recent
 * first; records searched within the same second are ordered by insertion,
 * newest first.
 * <p>
 * All operations are serialized on a single lock. The lock is never held
 * while the catalog is consulted.
 */
public class HistoryStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(HistoryStore.class);

    static final int SUMMARY_SIZE = 3;

    private static final Comparator<StoredRecord> MOST_RECENT_FIRST = Comparator
            .comparing((StoredRecord stored) -> stored.record().timeSearched())
            .thenComparingLong(StoredRecord::sequence)
            .reversed();

    private final ItemCatalog catalog;
    private final Clock clock;
    private final Lock lock = new ReentrantLock();
    private final Map<String, StoredRecord> records = new LinkedHashMap<>();
    private long nextSequence;

    public HistoryStore(ItemCatalog catalog, Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Record a completed search with all of its results.
     *
     * @param query   the query as submitted
     * @param results the ranked results in returned order
     * @return the created record
     */
    public HistoryRecord add(String query, List<SearchResult> results) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(results, "results");
        List<HistoryEntry> entries = results.stream()
                .map(result -> new HistoryEntry(result.id(), result.confidence()))
                .toList();
        String timeSearched = DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));
        HistoryRecord record = new HistoryRecord(UUID.randomUUID().toString(), query, timeSearched, entries);

        lock.lock();
        try {
            records.put(record.id(), new StoredRecord(record, nextSequence++));
        } finally {
            lock.unlock();
        }
        LOGGER.info("Added history record {} for query '{}' with {} results", record.id(), query, entries.size());
        return record;
    }

    /**
     * List a window of the history, most recent first.
     *
     * @param startIndex position of the first record, beyond the end yields an
     *                   empty page
     * @param limit      maximum number of records, at least 1
     * @return the page with summaries of the top three results per record
     */
    public HistoryPage list(int startIndex, int limit) {
        if (startIndex < 0) {
            throw new IllegalArgumentException("startIndex must not be negative");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        List<HistoryRecord> window;
        int total;
        lock.lock();
        try {
            total = records.size();
            window = records.values().stream()
                    .sorted(MOST_RECENT_FIRST)
                    .skip(startIndex)
                    .limit(limit)
                    .map(StoredRecord::record)
                    .toList();
        } finally {
            lock.unlock();
        }

        List<HistorySummary> summaries = window.stream()
                .map(record -> new HistorySummary(record.id(), record.query(), record.timeSearched(),
                        resolve(record.entries().subList(0, Math.min(SUMMARY_SIZE, record.entries().size())))))
                .toList();
        LOGGER.info("Returning {} history items (startIndex={}, total={})", summaries.size(), startIndex, total);
        return new HistoryPage(summaries, total);
    }

    /**
     * Rebuild all stored results of a record, in their original order.
     *
     * @param historyId the record id
     * @return the results whose items still exist in the catalog
     * @throws HistoryNotFoundException if there is no such record
     */
    public List<SearchResult> getFullResults(String historyId) {
        HistoryRecord record = find(historyId);
        List<SearchResult> results = resolve(record.entries());
        LOGGER.debug("Rebuilt {} of {} results for history record {}", results.size(), record.entries().size(),
                historyId);
        return results;
    }

    /**
     * Remove a record.
     *
     * @param historyId the record id
     * @return {@code true} if a record was removed
     */
    public boolean delete(String historyId) {
        boolean deleted;
        lock.lock();
        try {
            deleted = records.remove(historyId) != null;
        } finally {
            lock.unlock();
        }
        if (deleted) {
            LOGGER.info("Deleted history record {}", historyId);
        } else {
            LOGGER.warn("History record {} not found", historyId);
        }
        return deleted;
    }

    int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    private HistoryRecord find(String historyId) {
        StoredRecord stored;
        lock.lock();
        try {
            stored = records.get(historyId);
        } finally {
            lock.unlock();
        }
        if (stored == null) {
            throw new HistoryNotFoundException(historyId);
        }
        return stored.record();
    }

    private List<SearchResult> resolve(List<HistoryEntry> entries) {
        if (entries.isEmpty()) {
            return List.of();
        }
        Set<Integer> ids = new LinkedHashSet<>();
        entries.forEach(entry -> ids.add(entry.itemId()));
        Map<Integer, CatalogItem> items = catalog.getByIds(ids);
        List<SearchResult> results = new ArrayList<>(entries.size());
        for (HistoryEntry entry : entries) {
            CatalogItem item = items.get(entry.itemId());
            if (item != null) {
                results.add(SearchResult.of(item, entry.confidence()));
            }
        }
        return results;
    }

    private record StoredRecord(HistoryRecord record, long sequence) {
    }
}
