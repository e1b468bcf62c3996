package com.oracle.deepsearch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class SearchResult {

    String title;

    String url;

    String description;

    String age; // freshness as reported by the search API, may be null
}
