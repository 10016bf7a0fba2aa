package com.newsrank.ranking.service.dedup;

import com.newsrank.ranking.util.TextUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 제목 토큰 Jaccard 유사도 그래프.
 *
 * 중복 제거 3단계(어휘 클러스터링)와 교차 소스 보너스가 같은 행렬을 공유합니다.
 * minSimilarity 이상인 쌍만 저장하며, 저장되지 않은 쌍의 유사도는 0으로 취급합니다.
 * 제목 토큰이 없는 노드는 어떤 간선도 갖지 않습니다.
 */
public final class SimilarityGraph {

    /**
     * 무방향 간선 (left &lt; right)
     */
    public record Edge(int left, int right, double similarity) {
    }

    private final int size;
    private final List<Edge> edges;
    private final List<Map<Integer, Double>> adjacency;

    private SimilarityGraph(int size, List<Edge> edges) {
        this.size = size;
        this.edges = Collections.unmodifiableList(edges);
        this.adjacency = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            adjacency.add(new HashMap<>());
        }
        for (Edge edge : edges) {
            adjacency.get(edge.left()).put(edge.right(), edge.similarity());
            adjacency.get(edge.right()).put(edge.left(), edge.similarity());
        }
    }

    /**
     * 호출 스레드에서 그래프를 생성합니다.
     */
    public static SimilarityGraph build(List<Set<String>> tokenSets, double minSimilarity) {
        return build(tokenSets, minSimilarity, null, Integer.MAX_VALUE);
    }

    /**
     * 노드 수가 parallelMinSize 이상이면 행 단위로 executor에서 병렬 계산합니다.
     * 행 결과는 인덱스 순서대로 합쳐지므로 간선 순서는 실행 방식과 무관하게 동일합니다.
     *
     * @param tokenSets       노드별 제목 토큰 집합
     * @param minSimilarity   저장할 최소 유사도 (포함)
     * @param executor        행 계산 실행자 (null이면 순차 계산)
     * @param parallelMinSize 병렬 계산을 시작하는 최소 노드 수
     */
    public static SimilarityGraph build(List<Set<String>> tokenSets, double minSimilarity,
                                        Executor executor, int parallelMinSize) {
        int n = tokenSets.size();
        List<Edge> edges = new ArrayList<>();

        if (executor != null && n >= parallelMinSize) {
            List<CompletableFuture<List<Edge>>> rows = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                final int row = i;
                rows.add(CompletableFuture.supplyAsync(() -> computeRow(tokenSets, row, minSimilarity), executor));
            }
            for (CompletableFuture<List<Edge>> row : rows) {
                edges.addAll(row.join());
            }
        } else {
            for (int i = 0; i < n; i++) {
                edges.addAll(computeRow(tokenSets, i, minSimilarity));
            }
        }
        return new SimilarityGraph(n, edges);
    }

    private static List<Edge> computeRow(List<Set<String>> tokenSets, int row, double minSimilarity) {
        Set<String> left = tokenSets.get(row);
        if (left.isEmpty()) {
            return List.of();
        }
        List<Edge> result = new ArrayList<>();
        for (int j = row + 1; j < tokenSets.size(); j++) {
            Set<String> right = tokenSets.get(j);
            if (right.isEmpty()) {
                continue;
            }
            double similarity = TextUtils.jaccard(left, right);
            if (similarity >= minSimilarity) {
                result.add(new Edge(row, j, similarity));
            }
        }
        return result;
    }

    public int size() {
        return size;
    }

    public double similarity(int i, int j) {
        if (i == j) {
            return 1.0;
        }
        return adjacency.get(i).getOrDefault(j, 0.0);
    }

    /**
     * threshold 이상인 간선 (left, right 오름차순)
     */
    public List<Edge> edges(double threshold) {
        return edges.stream()
                .filter(edge -> edge.similarity() >= threshold)
                .toList();
    }

    /**
     * threshold 이상으로 연결된 이웃 노드 (인덱스 오름차순)
     */
    public List<Integer> neighbors(int node, double threshold) {
        return adjacency.get(node).entrySet().stream()
                .filter(entry -> entry.getValue() >= threshold)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }
}
