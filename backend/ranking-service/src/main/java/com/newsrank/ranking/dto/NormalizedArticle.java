package com.newsrank.ranking.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Normalized news article as produced by the upstream normalizer.
 * Never mutated by the ranking pipeline.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class NormalizedArticle {

    @NotBlank(message = "Article id is required")
    String id;

    @NotBlank(message = "Source id is required")
    @JsonProperty("source_id")
    String sourceId;

    @JsonProperty("source_name")
    String sourceName;

    String title;

    String body;

    @JsonProperty("published_at")
    Instant publishedAt;

    String url;

    @JsonProperty("view_count")
    Long viewCount;

    @JsonProperty("share_count")
    Long shareCount;

    @JsonProperty("comment_count")
    Long commentCount;

    String category;

    @Builder.Default
    List<String> tags = List.of();

    /**
     * 조회/공유/댓글 중 하나라도 양수인지 여부
     */
    @JsonIgnore
    public boolean hasEngagement() {
        return positive(viewCount) || positive(shareCount) || positive(commentCount);
    }

    @JsonIgnore
    public long views() {
        return viewCount != null ? Math.max(0, viewCount) : 0;
    }

    @JsonIgnore
    public long shares() {
        return shareCount != null ? Math.max(0, shareCount) : 0;
    }

    @JsonIgnore
    public long comments() {
        return commentCount != null ? Math.max(0, commentCount) : 0;
    }

    @JsonIgnore
    public int bodyLength() {
        return body != null ? body.length() : 0;
    }

    private static boolean positive(Long value) {
        return value != null && value > 0;
    }
}
