package com.newsrank.ranking.service.dedup;

import com.newsrank.ranking.config.RankingProperties;
import com.newsrank.ranking.dto.DedupCluster;
import com.newsrank.ranking.dto.NormalizedArticle;
import com.newsrank.ranking.service.dedup.DeduplicationResult.Representative;
import com.newsrank.ranking.util.TextUtils;
import com.newsrank.ranking.util.UrlNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * 3단계 중복 제거 서비스
 *
 * 1. URL 동일성: 정규화된 URL 기준 최초 도착 기사만 유지
 * 2. 제목 동일성: 정규화된 제목의 MD5 해시 기준 최초 도착 기사만 유지
 * 3. 어휘 클러스터링: 제목 토큰 Jaccard 유사도가 임계값 이상인 쌍을 간선으로 하는 연결 요소,
 *    대표는 본문이 가장 긴 기사 (동률이면 먼저 도착한 기사)
 *
 * URL 또는 제목이 비어 있는 기사는 해당 단계에서 다른 기사와 묶이지 않습니다.
 */
@Service
@Slf4j
public class DeduplicationService {

    private final RankingProperties rankingProperties;
    private final Executor rankingExecutor;

    public DeduplicationService(RankingProperties rankingProperties,
                                @Qualifier("rankingExecutor") Executor rankingExecutor) {
        this.rankingProperties = rankingProperties;
        this.rankingExecutor = rankingExecutor;
    }

    /**
     * 설정된 임계값으로 중복 제거
     */
    public DeduplicationResult deduplicate(List<NormalizedArticle> articles) {
        return deduplicate(articles,
                rankingProperties.getDedup().getSimilarityThreshold(),
                rankingProperties.getCorroboration().getSimilarityThreshold());
    }

    /**
     * @param articles              입력 배치 (도착 순서)
     * @param similarityThreshold   클러스터링 임계값 (포함)
     * @param graphRetainThreshold  그래프에 함께 보관할 추가 임계값 (교차 소스 보너스용)
     */
    public DeduplicationResult deduplicate(List<NormalizedArticle> articles,
                                           double similarityThreshold,
                                           double graphRetainThreshold) {
        if (articles == null || articles.isEmpty()) {
            return DeduplicationResult.empty();
        }

        // Stage A
        List<Integer> afterUrl = dedupByUrl(articles);
        // Stage B
        List<Integer> afterTitle = dedupByTitle(articles, afterUrl);

        List<NormalizedArticle> survivors = afterTitle.stream().map(articles::get).toList();
        List<Set<String>> tokenSets = survivors.stream()
                .map(article -> TextUtils.tokenSet(article.getTitle()))
                .toList();

        // Stage C
        SimilarityGraph graph = SimilarityGraph.build(
                tokenSets,
                Math.min(similarityThreshold, graphRetainThreshold),
                rankingExecutor,
                rankingProperties.getDedup().getParallelMinArticles());

        List<List<Integer>> components = connectedComponents(graph, similarityThreshold);

        List<Representative> representatives = new ArrayList<>(components.size());
        List<DedupCluster> clusters = new ArrayList<>(components.size());
        for (List<Integer> component : components) {
            int chosen = selectRepresentative(survivors, component);
            NormalizedArticle representative = survivors.get(chosen);
            representatives.add(new Representative(
                    representative, afterTitle.get(chosen), chosen, component.size()));
            clusters.add(new DedupCluster(
                    representative.getId(),
                    component.stream().map(i -> survivors.get(i).getId()).toList()));
        }

        log.info("Deduplication: {} → URL {} → title {} → clusters {}",
                articles.size(), afterUrl.size(), afterTitle.size(), representatives.size());

        return DeduplicationResult.builder()
                .totalInput(articles.size())
                .afterUrlDedup(afterUrl.size())
                .afterTitleDedup(afterTitle.size())
                .survivors(survivors)
                .graph(graph)
                .representatives(representatives)
                .clusters(clusters)
                .build();
    }

    /**
     * 정규화된 URL 기준 최초 도착 기사의 인덱스
     */
    List<Integer> dedupByUrl(List<NormalizedArticle> articles) {
        Set<String> seen = new HashSet<>();
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < articles.size(); i++) {
            String normalized = UrlNormalizer.normalize(articles.get(i).getUrl());
            if (normalized == null || seen.add(normalized)) {
                kept.add(i);
            } else {
                log.debug("URL duplicate dropped: id={}, url={}", articles.get(i).getId(), normalized);
            }
        }
        return kept;
    }

    /**
     * 정규화된 제목 해시 기준 최초 도착 기사의 인덱스
     */
    List<Integer> dedupByTitle(List<NormalizedArticle> articles, List<Integer> candidates) {
        Set<String> seen = new HashSet<>();
        List<Integer> kept = new ArrayList<>();
        for (int index : candidates) {
            String normalized = TextUtils.normalizeTitle(articles.get(index).getTitle());
            if (normalized.isEmpty() || seen.add(md5(normalized))) {
                kept.add(index);
            } else {
                log.debug("Title duplicate dropped: id={}", articles.get(index).getId());
            }
        }
        return kept;
    }

    /**
     * 간선을 (left, right) 순서로 합치는 union-find.
     * 루트는 항상 구성원 중 가장 작은 인덱스이므로 요소는 가장 이른 구성원 순서로 나열됩니다.
     */
    static List<List<Integer>> connectedComponents(SimilarityGraph graph, double threshold) {
        int n = graph.size();
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
        }
        for (SimilarityGraph.Edge edge : graph.edges(threshold)) {
            int left = find(parent, edge.left());
            int right = find(parent, edge.right());
            if (left != right) {
                parent[Math.max(left, right)] = Math.min(left, right);
            }
        }

        Map<Integer, List<Integer>> components = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            components.computeIfAbsent(find(parent, i), root -> new ArrayList<>()).add(i);
        }
        return new ArrayList<>(components.values());
    }

    private static int find(int[] parent, int node) {
        int root = node;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[node] != root) {
            int next = parent[node];
            parent[node] = root;
            node = next;
        }
        return root;
    }

    private static int selectRepresentative(List<NormalizedArticle> survivors, List<Integer> component) {
        int best = component.get(0);
        for (int candidate : component) {
            if (survivors.get(candidate).bodyLength() > survivors.get(best).bodyLength()) {
                best = candidate;
            }
        }
        return best;
    }

    static String md5(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not available", e);
        }
    }
}
