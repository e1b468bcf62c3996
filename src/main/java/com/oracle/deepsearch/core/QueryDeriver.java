package com.oracle.deepsearch.core;

import com.oracle.deepsearch.model.QueryConfig;

import java.util.List;

public interface QueryDeriver {

    /**
     * Derives the next batch of sub-queries for a topic.
     *
     * @param topic         the research topic
     * @param priorFindings findings of earlier rounds in round order, empty on the first round
     * @param batchSize     number of queries wanted
     * @return the batch; may be empty, in which case the session falls back to the topic itself
     */
    List<QueryConfig> derive(String topic, List<String> priorFindings, int batchSize);
}
