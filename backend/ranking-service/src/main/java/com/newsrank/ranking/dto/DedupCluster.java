package com.newsrank.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 중복 클러스터: 서로 중복으로 판정된 기사 ID 목록과 대표 기사 ID
 *
 * @param representativeId 대표 기사 ID (가장 긴 본문, 동률이면 먼저 도착한 기사)
 * @param memberIds        도착 순서대로 정렬된 구성원 ID
 */
public record DedupCluster(
        @JsonProperty("representative_id") String representativeId,
        @JsonProperty("member_ids") List<String> memberIds
) {
    public DedupCluster {
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
    }

    public int size() {
        return memberIds.size();
    }
}
