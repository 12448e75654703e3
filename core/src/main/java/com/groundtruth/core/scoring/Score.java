package com.groundtruth.core.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"TP", "FP", "FN", "total_pred", "total_gt",
        "precision", "recall", "hallucination_rate", "provenance_completeness"})
public record Score(
        @JsonProperty("TP") int truePositives,
        @JsonProperty("FP") int falsePositives,
        @JsonProperty("FN") int falseNegatives,
        @JsonProperty("total_pred") int totalPredicted,
        @JsonProperty("total_gt") int totalGold,
        @JsonProperty("precision") double precision,
        @JsonProperty("recall") double recall,
        @JsonProperty("hallucination_rate") double hallucinationRate,
        @JsonProperty("provenance_completeness") double provenanceCompleteness
) {}
