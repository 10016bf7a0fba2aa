package com.newsrank.ranking.service;

import com.newsrank.ranking.config.RankingProperties;
import com.newsrank.ranking.config.RankingProperties.PresetWeights;
import com.newsrank.ranking.dto.NormalizedArticle;
import com.newsrank.ranking.dto.RankingPreset;
import com.newsrank.ranking.dto.RankingRequest;
import com.newsrank.ranking.dto.RankingResponse;
import com.newsrank.ranking.dto.ScoreVector;
import com.newsrank.ranking.exception.InvalidRankingOptionsException;
import com.newsrank.ranking.exception.RankingException;
import com.newsrank.ranking.exception.UnknownPresetException;
import com.newsrank.ranking.service.dedup.DeduplicationResult;
import com.newsrank.ranking.service.dedup.DeduplicationResult.Representative;
import com.newsrank.ranking.service.dedup.DeduplicationService;
import com.newsrank.ranking.service.integrity.IntegrityAssessor;
import com.newsrank.ranking.service.integrity.IntegrityAssessor.IntegrityReport;
import com.newsrank.ranking.service.ranking.RankingOptions;
import com.newsrank.ranking.service.ranking.RankingOutcome;
import com.newsrank.ranking.service.ranking.RankingService;
import com.newsrank.ranking.service.ranking.ScoredCandidate;
import com.newsrank.ranking.service.scoring.CredibilityScorer;
import com.newsrank.ranking.service.scoring.CredibilityScorer.CredibilityReport;
import com.newsrank.ranking.service.scoring.PopularityScorer;
import com.newsrank.ranking.service.scoring.PopularityScorer.PopularityReport;
import com.newsrank.ranking.service.scoring.QualityScorer;
import com.newsrank.ranking.service.scoring.QualityScorer.QualityReport;
import com.newsrank.ranking.service.scoring.RelevanceScorer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 중복 제거 → 무결성 / 신뢰도·품질 / 인기도 → 랭킹 파이프라인
 *
 * 옵션 검증은 어떤 처리보다 먼저 수행합니다.
 * 무결성, 신뢰도, 품질, 인기도 계산은 rankingExecutor 에서 동시에 실행되며 모두 끝난 뒤 점수 벡터로 합쳐집니다.
 * 입력 배치와 기사 객체는 변경하지 않습니다.
 */
@Service
@Slf4j
public class RankingPipelineService {

    private final DeduplicationService deduplicationService;
    private final IntegrityAssessor integrityAssessor;
    private final CredibilityScorer credibilityScorer;
    private final QualityScorer qualityScorer;
    private final RelevanceScorer relevanceScorer;
    private final PopularityScorer popularityScorer;
    private final RankingService rankingService;
    private final RankingProperties rankingProperties;
    private final Clock clock;
    private final Executor rankingExecutor;
    private final MeterRegistry meterRegistry;

    private Counter requestCounter;
    private Counter articlesInCounter;
    private Counter duplicatesRemovedCounter;
    private Counter excludedCounter;
    private Counter rejectedRequestCounter;
    private Timer rankingTimer;

    public RankingPipelineService(
            DeduplicationService deduplicationService,
            IntegrityAssessor integrityAssessor,
            CredibilityScorer credibilityScorer,
            QualityScorer qualityScorer,
            RelevanceScorer relevanceScorer,
            PopularityScorer popularityScorer,
            RankingService rankingService,
            RankingProperties rankingProperties,
            Clock clock,
            @Qualifier("rankingExecutor") Executor rankingExecutor,
            MeterRegistry meterRegistry
    ) {
        this.deduplicationService = deduplicationService;
        this.integrityAssessor = integrityAssessor;
        this.credibilityScorer = credibilityScorer;
        this.qualityScorer = qualityScorer;
        this.relevanceScorer = relevanceScorer;
        this.popularityScorer = popularityScorer;
        this.rankingService = rankingService;
        this.rankingProperties = rankingProperties;
        this.clock = clock;
        this.rankingExecutor = rankingExecutor;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        requestCounter = Counter.builder("newsrank.ranking.requests")
                .description("Number of ranking requests processed")
                .register(meterRegistry);

        articlesInCounter = Counter.builder("newsrank.ranking.articles.input")
                .description("Number of articles received for ranking")
                .register(meterRegistry);

        duplicatesRemovedCounter = Counter.builder("newsrank.ranking.articles.deduplicated")
                .description("Number of articles merged away by deduplication")
                .register(meterRegistry);

        excludedCounter = Counter.builder("newsrank.ranking.articles.excluded")
                .description("Number of representatives excluded by the policy filter")
                .register(meterRegistry);

        rejectedRequestCounter = Counter.builder("newsrank.ranking.requests.rejected")
                .description("Number of ranking requests rejected for invalid options")
                .register(meterRegistry);

        rankingTimer = Timer.builder("newsrank.ranking.duration")
                .description("Time taken to rank one batch")
                .register(meterRegistry);
    }

    /**
     * 한 배치를 랭킹합니다.
     *
     * @throws UnknownPresetException          등록되지 않은 프리셋
     * @throws InvalidRankingOptionsException  범위를 벗어난 옵션
     */
    public RankingResponse rank(RankingRequest request) {
        ResolvedRequest resolved;
        try {
            resolved = resolve(request);
        } catch (RankingException e) {
            rejectedRequestCounter.increment();
            throw e;
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return execute(request.getArticles(), resolved);
        } finally {
            sample.stop(rankingTimer);
        }
    }

    private RankingResponse execute(List<NormalizedArticle> articles, ResolvedRequest resolved) {
        requestCounter.increment();
        List<NormalizedArticle> batch = articles != null ? articles : List.of();
        articlesInCounter.increment(batch.size());

        Instant now = clock.instant();
        log.info("Ranking started: {} articles, preset={}", batch.size(), resolved.preset().name());

        DeduplicationResult dedup = deduplicationService.deduplicate(
                batch, resolved.similarityThreshold(), resolved.corroborationThreshold());
        duplicatesRemovedCounter.increment(batch.size() - dedup.getAfterClustering());

        List<Representative> representatives = dedup.getRepresentatives();
        List<ScoredCandidate> candidates = score(representatives, dedup, resolved, now);

        RankingOutcome outcome = rankingService.rank(candidates, resolved.preset(), resolved.options());
        excludedCounter.increment(outcome.excluded().size());

        return RankingResponse.builder()
                .preset(resolved.preset().name())
                .totalInput(dedup.getTotalInput())
                .afterUrlDedup(dedup.getAfterUrlDedup())
                .afterTitleDedup(dedup.getAfterTitleDedup())
                .afterClustering(dedup.getAfterClustering())
                .eligibleCount(outcome.eligibleCount())
                .results(outcome.results())
                .excluded(outcome.excluded())
                .clusters(dedup.getClusters())
                .build();
    }

    /**
     * 무결성 / 신뢰도·품질·관련성 / 인기도를 동시에 계산한 뒤 대표별 점수 벡터로 합칩니다.
     */
    private List<ScoredCandidate> score(List<Representative> representatives,
                                        DeduplicationResult dedup,
                                        ResolvedRequest resolved,
                                        Instant now) {
        if (representatives.isEmpty()) {
            return List.of();
        }
        List<NormalizedArticle> repArticles = representatives.stream().map(Representative::article).toList();

        CompletableFuture<List<IntegrityReport>> integrityFuture = CompletableFuture.supplyAsync(
                () -> repArticles.stream().map(integrityAssessor::assess).toList(), rankingExecutor);

        CompletableFuture<List<CredibilityReport>> credibilityFuture = CompletableFuture.supplyAsync(
                () -> credibilityScorer.score(representatives, dedup.getGraph(), resolved.corroborationThreshold()),
                rankingExecutor);

        CompletableFuture<List<QualityReport>> qualityFuture = CompletableFuture.supplyAsync(
                () -> repArticles.stream().map(qualityScorer::score).toList(), rankingExecutor);

        CompletableFuture<List<PopularityReport>> popularityFuture = CompletableFuture.supplyAsync(
                () -> popularityScorer.score(repArticles, now), rankingExecutor);

        try {
            CompletableFuture.allOf(integrityFuture, credibilityFuture, qualityFuture, popularityFuture).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Scoring stage failed: {}", cause.getMessage(), cause);
            throw new RankingException("SCORING_FAILED", "Scoring stage failed: " + cause.getMessage(), cause);
        }

        List<IntegrityReport> integrity = integrityFuture.join();
        List<CredibilityReport> credibility = credibilityFuture.join();
        List<QualityReport> quality = qualityFuture.join();
        List<PopularityReport> popularity = popularityFuture.join();

        List<ScoredCandidate> candidates = new ArrayList<>(representatives.size());
        for (int i = 0; i < representatives.size(); i++) {
            Representative representative = representatives.get(i);
            double relevance = relevanceScorer.score(
                    representative.article(), quality.get(i).getQuality(), resolved.keywords());
            ScoreVector scores = combine(integrity.get(i), credibility.get(i), quality.get(i),
                    popularity.get(i), relevance);
            candidates.add(new ScoredCandidate(representative.article(), scores,
                    representative.arrivalIndex(), representative.clusterSize()));
        }
        return candidates;
    }

    static ScoreVector combine(IntegrityReport integrity,
                               CredibilityReport credibility,
                               QualityReport quality,
                               PopularityReport popularity,
                               double relevance) {
        Set<String> flags = new LinkedHashSet<>();
        flags.addAll(integrity.getFlags());
        flags.addAll(credibility.getFlags());
        flags.addAll(quality.getFlags());

        return ScoreVector.builder()
                .integrity(integrity.getIntegrity())
                .titleBodyConsistency(integrity.getConsistency())
                .contaminationScore(integrity.getContamination())
                .spamScore(integrity.getSpam())
                .credibility(credibility.getCredibility())
                .sourceTrust(credibility.getSourceTrust())
                .crossSourceBonus(credibility.getCrossSourceBonus())
                .corroborationCount(credibility.getCorroborationCount())
                .quality(quality.getQuality())
                .evidenceScore(quality.getEvidence())
                .sensationalismPenalty(quality.getSensationalism())
                .relevance(relevance)
                .popularity(popularity.getPopularity())
                .trendingVelocity(popularity.getTrendingVelocity())
                .engagementBased(popularity.isEngagementBased())
                .flags(List.copyOf(flags))
                .build();
    }

    /**
     * 설정된 프리셋 목록
     */
    public List<RankingPreset> getPresets() {
        return rankingProperties.getPresets().entrySet().stream()
                .map(entry -> toPreset(entry.getKey(), entry.getValue()))
                .toList();
    }

    public RankingPreset resolvePreset(String name) {
        String presetName = name != null && !name.isBlank() ? name.trim() : rankingProperties.getDefaults().getPreset();
        Map<String, PresetWeights> presets = rankingProperties.getPresets();
        PresetWeights weights = presets.get(presetName);
        if (weights == null) {
            throw new UnknownPresetException(presetName, presets.keySet());
        }
        return toPreset(presetName, weights);
    }

    ResolvedRequest resolve(RankingRequest request) {
        RankingProperties.Defaults defaults = rankingProperties.getDefaults();

        int limit = request.getLimit() != null ? request.getLimit() : defaults.getLimit();
        int offset = request.getOffset() != null ? request.getOffset() : defaults.getOffset();
        int cap = request.getDiversityCap() != null ? request.getDiversityCap() : defaults.getDiversityCap();
        double similarity = request.getSimilarityThreshold() != null
                ? request.getSimilarityThreshold()
                : rankingProperties.getDedup().getSimilarityThreshold();
        double corroboration = request.getCorroborationThreshold() != null
                ? request.getCorroborationThreshold()
                : rankingProperties.getCorroboration().getSimilarityThreshold();

        if (request.getArticles() != null && request.getArticles().stream().anyMatch(Objects::isNull)) {
            throw new InvalidRankingOptionsException("articles must not contain null entries");
        }
        requireNonNegative("limit", limit);
        requireNonNegative("offset", offset);
        requireNonNegative("diversity_cap", cap);
        requireUnitInterval("similarity_threshold", similarity);
        requireUnitInterval("corroboration_threshold", corroboration);

        RankingPreset preset = resolvePreset(request.getPreset());
        List<String> keywords = request.getKeywords() != null ? new ArrayList<>(request.getKeywords()) : List.<String>of();

        return new ResolvedRequest(preset,
                new RankingOptions(limit, offset, request.isDiversity(), cap),
                similarity, corroboration, keywords);
    }

    private static RankingPreset toPreset(String name, PresetWeights weights) {
        return new RankingPreset(name, weights.getPopularity(), weights.getRelevance(),
                weights.getQuality(), weights.getCredibility());
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw InvalidRankingOptionsException.negative(name, value);
        }
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw InvalidRankingOptionsException.thresholdOutOfRange(name, value);
        }
    }

    record ResolvedRequest(
            RankingPreset preset,
            RankingOptions options,
            double similarityThreshold,
            double corroborationThreshold,
            List<String> keywords
    ) {
    }
}
