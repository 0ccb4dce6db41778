package ch.so.arp.explorer.search;

import static ch.so.arp.explorer.search.CatalogFixtures.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Set;

import jakarta.validation.ConstraintViolationException;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class HistoryControllerTest {

    private final SearchService searchService = mock(SearchService.class);
    private final MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new HistoryController(searchService))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();

    @Test
    void listsHistoryPage() throws Exception {
        HistorySummary summary = new HistorySummary("abc", "moon landing", "2024-03-01T10:00:00Z",
                List.of(result(2, 1.0d), result(5, 0.8d)));
        when(searchService.listHistory(4, 2)).thenReturn(new HistoryPage(List.of(summary), 5));

        mockMvc.perform(get("/api/history").param("startIndex", "4").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(5))
                .andExpect(jsonPath("$.items[0].id").value("abc"))
                .andExpect(jsonPath("$.items[0].query").value("moon landing"))
                .andExpect(jsonPath("$.items[0].time_searched").value("2024-03-01T10:00:00Z"))
                .andExpect(jsonPath("$.items[0].top_three_images.length()").value(2))
                .andExpect(jsonPath("$.items[0].top_three_images[1].image_url")
                        .value("https://images.example/5.jpg"));
    }

    @Test
    void historyDefaultsToFirstTenRecords() throws Exception {
        when(searchService.listHistory(0, 10)).thenReturn(new HistoryPage(List.of(), 0));

        mockMvc.perform(get("/api/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(0))
                .andExpect(jsonPath("$.items.length()").value(0));

        verify(searchService).listHistory(0, 10);
    }

    @Test
    void replaysStoredResults() throws Exception {
        when(searchService.getHistoryResults("abc")).thenReturn(List.of(result(2, 1.0d)));

        mockMvc.perform(get("/api/history/abc/results"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(2))
                .andExpect(jsonPath("$[0].confidence").value(1.0d));
    }

    @Test
    void unknownHistoryIsNotFound() throws Exception {
        when(searchService.getHistoryResults("missing")).thenThrow(new HistoryNotFoundException("missing"));

        mockMvc.perform(get("/api/history/missing/results"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ApiError.HISTORY_NOT_FOUND))
                .andExpect(jsonPath("$.message").value("History item with ID missing not found"))
                .andExpect(jsonPath("$.path").value("/api/history/missing/results"));
    }

    @Test
    void deleteAnswersNoContent() throws Exception {
        when(searchService.deleteHistory("abc")).thenReturn(true);

        mockMvc.perform(delete("/api/history/abc"))
                .andExpect(status().isNoContent());

        verify(searchService).deleteHistory("abc");
    }

    @Test
    void deleteOfUnknownHistoryIsNotFound() throws Exception {
        when(searchService.deleteHistory("gone")).thenReturn(false);

        mockMvc.perform(delete("/api/history/gone"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ApiError.HISTORY_NOT_FOUND));
    }

    @Test
    void constraintViolationsBecomeBadRequest() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/history");

        ResponseEntity<ApiError> response = new ApiExceptionHandler()
                .handleValidation(new ConstraintViolationException("history.limit: must be less than or equal to 100",
                        Set.of()), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().code()).isEqualTo(ApiError.VALIDATION_ERROR);
        assertThat(response.getBody().message()).contains("history.limit");
        assertThat(response.getBody().path()).isEqualTo("/api/history");
        assertThat(response.getBody().errorId()).hasSize(8);
    }
}
