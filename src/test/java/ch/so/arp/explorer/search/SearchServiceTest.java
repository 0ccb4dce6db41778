package ch.so.arp.explorer.search;

import static ch.so.arp.explorer.search.CatalogFixtures.item;
import static ch.so.arp.explorer.search.CatalogFixtures.withSimilarity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.util.List;

import org.junit.jupiter.api.Test;

class SearchServiceTest {

    private final InMemoryItemCatalog catalog = new InMemoryItemCatalog(List.of(
            new EmbeddedItem(item(1), withSimilarity(0.1d)),
            new EmbeddedItem(item(2), withSimilarity(0.9d)),
            new EmbeddedItem(item(3), null),
            new EmbeddedItem(item(4), withSimilarity(0.5d))));
    private final HistoryStore historyStore = new HistoryStore(catalog, Clock.systemUTC());

    @Test
    void ranksCatalogAndRecordsHistory() {
        EmbeddingProvider embeddingProvider = mock(EmbeddingProvider.class);
        when(embeddingProvider.embed("moon landing")).thenReturn(new float[] { 1.0f, 0.0f });
        SearchService service = new SearchService(embeddingProvider, catalog, new SimilarityRanker(), historyStore);

        List<SearchResult> results = service.search("  moon landing ", 2, true);

        assertThat(results).extracting(SearchResult::id).containsExactly(2, 4);
        HistoryPage page = historyStore.list(0, 10);
        assertThat(page.total()).isEqualTo(1);
        HistorySummary summary = page.items().get(0);
        assertThat(summary.query()).isEqualTo("  moon landing ");
        assertThat(service.getHistoryResults(summary.id())).isEqualTo(results);
    }

    @Test
    void skipsHistoryWhenRequested() {
        SearchService service = new SearchService(alongXAxis(), catalog, new SimilarityRanker(), historyStore);

        assertThat(service.search("moon", 5, false)).hasSize(3);
        assertThat(historyStore.size()).isZero();
    }

    @Test
    void blankQueryTouchesNeitherEmbeddingsNorCatalog() {
        EmbeddingProvider embeddingProvider = mock(EmbeddingProvider.class);
        ItemCatalog itemCatalog = mock(ItemCatalog.class);
        HistoryStore store = new HistoryStore(itemCatalog, Clock.systemUTC());
        SearchService service = new SearchService(embeddingProvider, itemCatalog, new SimilarityRanker(), store);

        assertThat(service.search("   ", 10, true)).isEmpty();
        assertThat(service.search("", 10, true)).isEmpty();
        assertThat(service.search(null, 10, true)).isEmpty();

        verifyNoInteractions(embeddingProvider, itemCatalog);
        assertThat(store.size()).isZero();
    }

    @Test
    void failedQueryEmbeddingYieldsNoResults() {
        EmbeddingProvider embeddingProvider = mock(EmbeddingProvider.class);
        when(embeddingProvider.embed(anyString())).thenThrow(new EmbeddingException("model server down"));
        SearchService service = new SearchService(embeddingProvider, catalog, new SimilarityRanker(), historyStore);

        assertThat(service.search("moon", 5, true)).isEmpty();
        assertThat(historyStore.size()).isZero();
    }

    @Test
    void emptyOutcomeIsNotRecorded() {
        InMemoryItemCatalog unembedded = new InMemoryItemCatalog(List.of(new EmbeddedItem(item(1), null)));
        HistoryStore store = new HistoryStore(unembedded, Clock.systemUTC());
        SearchService service = new SearchService(alongXAxis(), unembedded,
                new SimilarityRanker(), store);

        assertThat(service.search("moon", 5, true)).isEmpty();
        assertThat(store.size()).isZero();
        assertThat(service.listSources()).extracting(CatalogItem::id).containsExactly(1);
    }

    @Test
    void deletesHistoryThroughStore() {
        SearchService service = new SearchService(alongXAxis(), catalog,
                new SimilarityRanker(), historyStore);
        service.search("moon", 5, true);
        String historyId = service.listHistory(0, 1).items().get(0).id();

        assertThat(service.deleteHistory(historyId)).isTrue();
        assertThat(service.deleteHistory(historyId)).isFalse();
        assertThat(service.listHistory(0, 1).total()).isZero();
    }

    private static EmbeddingProvider alongXAxis() {
        EmbeddingProvider embeddingProvider = mock(EmbeddingProvider.class);
        when(embeddingProvider.embed(anyString())).thenReturn(new float[] { 1.0f, 0.0f });
        return embeddingProvider;
    }
}
