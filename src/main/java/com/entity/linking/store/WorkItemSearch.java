package com.entity.linking.store;

import com.entity.linking.core.model.WorkItemHit;

import java.util.List;

/**
 * Content and semantic search over work items.
 */
public interface WorkItemSearch {

    /**
     * @return at most {@link SearchQuery#limit()} hits, in backend order
     * @throws BackendUnavailableException if the search backend cannot be reached
     */
    List<WorkItemHit> search(SearchQuery query);
}
