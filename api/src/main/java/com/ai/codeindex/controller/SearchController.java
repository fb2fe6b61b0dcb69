package com.ai.codeindex.controller;

import com.ai.codeindex.dto.SearchRequest;
import com.ai.codeindex.dto.SearchResponse;
import com.ai.codeindex.index.SearchFilters;
import com.ai.codeindex.service.HybridSearchService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {

    private final HybridSearchService searchService;

    public SearchController(HybridSearchService searchService) {
        this.searchService = searchService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/search \
     *     -H "Content-Type: application/json" \
     *     -d '{"query":"retry with backoff","filters":{"repo_id":"commons-lang"},"top_n":5}'
     */
    @PostMapping("/search")
    public SearchResponse search(@RequestBody @Valid SearchRequest request) {
        SearchFilters filters = request.filters() == null
                ? SearchFilters.none()
                : new SearchFilters(request.filters().repoId(), request.filters().commit());
        return searchService.search(request.query(), filters, request.topN());
    }
}
