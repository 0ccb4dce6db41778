package ch.so.arp.explorer.search;

import java.util.List;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for browsing, replaying and deleting past searches.
 */
@RestController
@RequestMapping("/api/history")
@Validated
public class HistoryController {

    private static final Logger LOGGER = LoggerFactory.getLogger(HistoryController.class);

    private final SearchService searchService;

    public HistoryController(SearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping
    public HistoryPage history(
            @RequestParam(name = "startIndex", defaultValue = "0") @PositiveOrZero int startIndex,
            @RequestParam(name = "limit", defaultValue = "10") @Min(1) @Max(SearchController.MAX_LIMIT) int limit) {
        return searchService.listHistory(startIndex, limit);
    }

    @GetMapping("/{historyId}/results")
    public List<SearchResult> results(@PathVariable String historyId) {
        return searchService.getHistoryResults(historyId);
    }

    @DeleteMapping("/{historyId}")
    public ResponseEntity<Void> delete(@PathVariable String historyId) {
        if (!searchService.deleteHistory(historyId)) {
            throw new HistoryNotFoundException(historyId);
        }
        LOGGER.debug("History record {} removed on request", historyId);
        return ResponseEntity.noContent().build();
    }
}
