package com.newsrank.ranking.service.dedup;

import com.newsrank.ranking.dto.DedupCluster;
import com.newsrank.ranking.dto.NormalizedArticle;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 3단계 중복 제거 결과
 */
@Value
@Builder
public class DeduplicationResult {

    int totalInput;

    int afterUrlDedup;

    int afterTitleDedup;

    /**
     * 2단계(제목 동일성)까지 통과한 기사, 도착 순서
     */
    List<NormalizedArticle> survivors;

    /**
     * survivors 기준 유사도 그래프
     */
    SimilarityGraph graph;

    /**
     * 클러스터 대표, 클러스터의 가장 이른 구성원 순서
     */
    List<Representative> representatives;

    /**
     * survivors의 분할 (representatives와 같은 순서)
     */
    List<DedupCluster> clusters;

    public int getAfterClustering() {
        return representatives.size();
    }

    /**
     * @param article       대표 기사
     * @param arrivalIndex  입력 배치에서의 위치
     * @param survivorIndex survivors / graph 에서의 위치
     * @param clusterSize   소속 클러스터 크기
     */
    public record Representative(
            NormalizedArticle article,
            int arrivalIndex,
            int survivorIndex,
            int clusterSize
    ) {
    }

    public static DeduplicationResult empty() {
        return DeduplicationResult.builder()
                .survivors(List.of())
                .graph(SimilarityGraph.build(List.of(), 1.0))
                .representatives(List.of())
                .clusters(List.of())
                .build();
    }
}
