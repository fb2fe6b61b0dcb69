package com.ai.codeindex.controller;

import com.ai.codeindex.config.SecurityConfig;
import com.ai.codeindex.dto.Citation;
import com.ai.codeindex.dto.SearchResponse;
import com.ai.codeindex.dto.SearchResult;
import com.ai.codeindex.exception.SearchUnavailableException;
import com.ai.codeindex.index.SearchFilters;
import com.ai.codeindex.service.HybridSearchService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SearchController.class)
@Import(SecurityConfig.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HybridSearchService searchService;

    private static SearchResponse oneResult() {
        SearchResult result = new SearchResult("r1", 0.0361, SearchResult.ResultSource.FUSED,
                new Citation("src/Retry.java", 10, 42, "c0ffee"), 1, 2, "java", "class Retry {");
        return new SearchResponse("retry", List.of(result), new SearchResponse.Diagnostics(
                3, 5, 6, 0, 60, 1.2, 1.0, false, List.of(), 12));
    }

    @Test
    void search_returnsCitedResultsAndDiagnostics() throws Exception {
        when(searchService.search(eq("retry"), any(), eq(5))).thenReturn(oneResult());

        mockMvc.perform(post("/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"query": "retry", "top_n": 5}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].citation.path").value("src/Retry.java"))
                .andExpect(jsonPath("$.results[0].citation.start_line").value(10))
                .andExpect(jsonPath("$.results[0].citation.commit").value("c0ffee"))
                .andExpect(jsonPath("$.results[0].source").value("FUSED"))
                .andExpect(jsonPath("$.results[0].lexical_rank").value(1))
                .andExpect(jsonPath("$.diagnostics.rrf_k").value(60))
                .andExpect(jsonPath("$.diagnostics.degraded").value(false));
    }

    @Test
    void search_passesFilters() throws Exception {
        when(searchService.search(anyString(), any(), any())).thenReturn(oneResult());

        mockMvc.perform(post("/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"query": "retry", "filters": {"repo_id": "demo", "commit": "c0ffee"}}
                                """))
                .andExpect(status().isOk());

        verify(searchService).search("retry", new SearchFilters("demo", "c0ffee"), null);
    }

    @Test
    void search_blankQueryIsRejectedBeforeTheService() throws Exception {
        mockMvc.perform(post("/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"query": " "}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.details.query").value("query must not be blank"));

        verify(searchService, never()).search(any(), any(), any());
    }

    @Test
    void search_nonPositiveTopNIsBadRequest() throws Exception {
        mockMvc.perform(post("/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"query": "retry", "top_n": 0}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.topN").value("top_n must be positive"));

        verify(searchService, never()).search(any(), any(), any());
    }

    @Test
    void search_bothBranchesDownIsServiceUnavailable() throws Exception {
        when(searchService.search(anyString(), any(), any()))
                .thenThrow(new SearchUnavailableException("Both retrieval branches failed"));

        mockMvc.perform(post("/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"query": "retry"}
                                """))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("SEARCH_UNAVAILABLE"));
    }
}
