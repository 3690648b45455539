package com.entity.linking.store.http;

import com.entity.linking.core.model.WorkItemHit;
import com.entity.linking.store.SearchQuery;
import com.entity.linking.store.WorkItemSearch;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link WorkItemSearch} backed by the unified search API ({@code GET /api/search}).
 * The work item kind is read from the result's {@code metadata.kind}.
 */
public class HttpWorkItemSearch implements WorkItemSearch {

    static final String PATH = "/api/search";

    private final BackendClient client;

    public HttpWorkItemSearch(BackendClient client) {
        this.client = client;
    }

    @Override
    public List<WorkItemHit> search(SearchQuery query) {
        SearchPage page = client.get(PATH, BackendClient.params(
                        "q", query.query(),
                        "types", query.types(),
                        "limit", String.valueOf(query.limit()),
                        "semantic", String.valueOf(query.semantic())),
                SearchPage.class).orElse(null);
        if (page == null || page.results() == null) {
            return List.of();
        }

        List<WorkItemHit> hits = new ArrayList<>(page.results().size());
        for (SearchResult result : page.results()) {
            if (result.id() == null || hits.size() >= query.limit()) {
                continue;
            }
            String kind = result.metadata() != null ? result.metadata().kind() : null;
            hits.add(new WorkItemHit(result.id(), result.title(), result.score(), kind));
        }
        return hits;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchPage(
            @JsonProperty("results") List<SearchResult> results,
            @JsonProperty("search_type") String searchType
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResult(
            @JsonProperty("id") String id,
            @JsonProperty("title") String title,
            @JsonProperty("score") double score,
            @JsonProperty("type") String type,
            @JsonProperty("metadata") ResultMetadata metadata
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResultMetadata(
            @JsonProperty("kind") String kind,
            @JsonProperty("status") String status
    ) {
    }
}
