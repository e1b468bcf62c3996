package com.oracle.deepsearch.core;

import com.oracle.deepsearch.model.ExtractionResult;

import java.util.List;

/**
 * Answers research goals from the content behind a set of URLs.
 * Shared by every job, so implementations must be thread-safe.
 */
public interface Extractor {

    /**
     * @return one answer per goal keyed {@code goal1..goalN}; goals without an answer map to
     *         {@link ExtractionResult#NOT_FOUND}
     * @throws CollaboratorException when extraction fails
     */
    ExtractionResult extract(List<String> urls, List<String> goals);
}
