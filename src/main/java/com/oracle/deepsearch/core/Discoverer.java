package com.oracle.deepsearch.core;

import com.oracle.deepsearch.model.SearchResult;

import java.util.List;

/**
 * Finds references for a query. Shared by every job, so implementations must be thread-safe.
 */
public interface Discoverer {

    /**
     * @param query search query
     * @param count maximum number of results wanted
     * @return ordered results, possibly empty
     * @throws CollaboratorException when the lookup fails after the implementation's own retry
     */
    List<SearchResult> discover(String query, int count);
}
