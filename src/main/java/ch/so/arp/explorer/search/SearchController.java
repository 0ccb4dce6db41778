package ch.so.arp.explorer.search;

import java.util.List;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints listing the catalog and searching it with natural language.
 */
@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class SearchController {

    private static final Logger LOGGER = LoggerFactory.getLogger(SearchController.class);

    static final int MAX_LIMIT = 100;

    private final SearchService searchService;

    public SearchController(SearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping("/sources")
    public List<CatalogItem> sources() {
        List<CatalogItem> sources = searchService.listSources();
        LOGGER.info("Returning {} sources", sources.size());
        return sources;
    }

    /**
     * Search the catalog. Confidences of the results lie between 0.2 and 1.0.
     *
     * @param q           natural language query, blank yields no results
     * @param limit       maximum number of results (1-100)
     * @param skipHistory when {@code true} the search is not recorded
     * @return the results, most confident first
     */
    @GetMapping("/search")
    public List<SearchResult> search(
            @RequestParam(name = "q", defaultValue = "") String q,
            @RequestParam(name = "limit", defaultValue = "15") @Min(1) @Max(MAX_LIMIT) int limit,
            @RequestParam(name = "skipHistory", defaultValue = "false") boolean skipHistory) {
        return searchService.search(q, limit, !skipHistory);
    }
}
