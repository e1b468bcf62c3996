package com.oracle.deepsearch.core;

import com.oracle.deepsearch.model.ResearchResults;

import java.util.List;

public interface ReportSynthesizer {

    /**
     * Consolidates the findings of every round into the final report.
     *
     * @throws CollaboratorException when the report cannot be produced
     */
    ResearchResults synthesize(String topic, List<String> allFindings);
}
