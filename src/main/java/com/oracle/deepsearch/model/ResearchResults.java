package com.oracle.deepsearch.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Final consolidated output of a research session.
 */
@Value
@Builder(toBuilder = true)
public class ResearchResults {

    public static final String SYNTHESIS_FAILED_PREFIX = "Failed to synthesize research report: ";

    String mainReport;

    @Singular
    List<String> keyLearnings;

    @Singular("areaCovered")
    List<String> areasCovered;

    @Singular("areaToExplore")
    List<String> areasToExplore;

    @Singular
    List<String> visitedSources;

    String additionalNotes;

    /**
     * Placeholder produced when synthesis fails; the raw findings are kept as key learnings.
     */
    public static ResearchResults synthesisFailed(String reason, List<String> findings) {
        return ResearchResults.builder()
                .mainReport(SYNTHESIS_FAILED_PREFIX + reason)
                .keyLearnings(findings)
                .additionalNotes("Report synthesis failed; "
                        + "key learnings hold the unprocessed findings of every round.")
                .build();
    }
}
