package com.newsrank.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for ranking one batch of normalized articles.
 *
 * Unset options fall back to the configured defaults. Range checks
 * (negative limit, threshold outside [0, 1], ...) are done by the pipeline
 * before any processing so that the same rules apply to in-process callers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankingRequest {

    @NotNull(message = "Articles are required")
    private List<@NotNull(message = "Article must not be null") @Valid NormalizedArticle> articles;

    /** quality / trending / credible / latest */
    private String preset;

    private Integer limit;

    private Integer offset;

    @JsonProperty("diversity_cap")
    private Integer diversityCap;

    /**
     * Per-source cap on/off. When false no cap is applied.
     */
    @Builder.Default
    private boolean diversity = true;

    /**
     * Optional query keywords. When present a relevance score is computed from them,
     * otherwise relevance falls back to the quality score.
     */
    private List<String> keywords;

    /** Overrides the configured clustering threshold */
    @JsonProperty("similarity_threshold")
    private Double similarityThreshold;

    /** Overrides the configured corroboration threshold */
    @JsonProperty("corroboration_threshold")
    private Double corroborationThreshold;
}
