package com.oracle.deepsearch.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchRequest {

    @NotBlank(message = "Research topic cannot be blank")
    private String topic;

    @Min(value = 1, message = "Max depth must be at least 1")
    @Max(value = 10, message = "Max depth cannot exceed 10")
    private Integer maxDepth;

    @Min(value = 1, message = "Batch size must be at least 1")
    @Max(value = 10, message = "Batch size cannot exceed 10")
    private Integer batchSize;

    @Min(value = 1, message = "Max results must be at least 1")
    @Max(value = 20, message = "Max results cannot exceed 20")
    private Integer maxResults;

    private Boolean skipEmptyRounds;

    @Builder.Default
    private Boolean verbose = false; // include per-job detail of every round
}
