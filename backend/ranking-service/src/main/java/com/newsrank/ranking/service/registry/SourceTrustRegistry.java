package com.newsrank.ranking.service.registry;

import com.newsrank.ranking.config.SourceTrustProperties;
import com.newsrank.ranking.config.SourceTrustProperties.SourceDefinition;
import com.newsrank.ranking.dto.SourceRegistryStats;
import com.newsrank.ranking.dto.SourceStatus;
import com.newsrank.ranking.entity.SourceTier;
import com.newsrank.ranking.entity.SourceTrust;
import com.newsrank.ranking.exception.SourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 설정 기반 소스 신뢰도 레지스트리
 *
 * newsrank.sources.registry 에서 소스를 로드하고, 수집 성공/실패에 따른 런타임 상태를 관리합니다.
 * 연속 실패가 maxConsecutiveFailures 에 도달하면 소스를 자동 비활성화합니다.
 * 신뢰도 조회는 활성 여부와 무관하게 등록된 값을 반환합니다.
 */
@Service
@Slf4j
public class SourceTrustRegistry implements SourceTrustLookup {

    private final SourceTrustProperties properties;
    private final Clock clock;
    private final Map<String, SourceState> sources = new ConcurrentHashMap<>();

    public SourceTrustRegistry(SourceTrustProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        properties.getRegistry().forEach((id, definition) -> sources.put(id, SourceState.from(id, definition)));
        log.info("Source trust registry loaded: {} sources", sources.size());
    }

    @Override
    public Optional<SourceTrust> find(String sourceId) {
        if (sourceId == null) {
            return Optional.empty();
        }
        SourceState state = sources.get(sourceId);
        if (state == null) {
            return Optional.empty();
        }
        return Optional.of(new SourceTrust(sourceId, state.tier, resolveTrust(state)));
    }

    public SourceStatus getStatus(String sourceId) {
        return toStatus(require(sourceId));
    }

    public List<SourceStatus> getAll() {
        return sources.values().stream()
                .sorted((a, b) -> a.id.compareTo(b.id))
                .map(this::toStatus)
                .toList();
    }

    /**
     * 수집 성공 기록 (연속 실패 횟수 초기화)
     */
    public SourceStatus recordSuccess(String sourceId) {
        SourceState state = require(sourceId);
        synchronized (state) {
            Instant now = clock.instant();
            state.lastCrawled = now;
            state.lastSuccess = now;
            state.consecutiveFailures = 0;
        }
        log.debug("Source success recorded: {}", sourceId);
        return toStatus(state);
    }

    /**
     * 수집 실패 기록. 연속 실패 시 자동 비활성화
     */
    public SourceStatus recordFailure(String sourceId) {
        SourceState state = require(sourceId);
        int maxFailures = properties.getMaxConsecutiveFailures();
        synchronized (state) {
            state.lastCrawled = clock.instant();
            state.consecutiveFailures++;
            log.warn("Source failure recorded: {} ({} consecutive)", sourceId, state.consecutiveFailures);
            if (state.active && state.consecutiveFailures >= maxFailures) {
                state.active = false;
                log.error("Source deactivated after {} consecutive failures: {}", state.consecutiveFailures, sourceId);
            }
        }
        return toStatus(state);
    }

    /**
     * 비활성화된 소스 재활성화 (블랙리스트는 불가)
     *
     * @return 재활성화 여부
     */
    public boolean reactivate(String sourceId) {
        SourceState state = require(sourceId);
        if (state.tier == SourceTier.BLACKLIST) {
            log.warn("Blacklisted source cannot be reactivated: {}", sourceId);
            return false;
        }
        synchronized (state) {
            state.active = true;
            state.consecutiveFailures = 0;
        }
        log.info("Source reactivated: {}", sourceId);
        return true;
    }

    public SourceRegistryStats getStats() {
        Collection<SourceState> all = sources.values();
        Map<String, Long> byTier = new LinkedHashMap<>();
        for (SourceTier tier : SourceTier.values()) {
            long count = all.stream().filter(state -> state.tier == tier).count();
            if (count > 0) {
                byTier.put(tier.getValue(), count);
            }
        }
        int active = (int) all.stream().filter(SourceState::isUsable).count();
        int verified = (int) all.stream()
                .filter(state -> state.isUsable() && state.tier.isVerified())
                .count();
        return new SourceRegistryStats(all.size(), active, verified, byTier);
    }

    private SourceState require(String sourceId) {
        SourceState state = sourceId != null ? sources.get(sourceId) : null;
        if (state == null) {
            throw new SourceNotFoundException(sourceId);
        }
        return state;
    }

    private double resolveTrust(SourceState state) {
        return state.baseTrust != null ? state.baseTrust : properties.getTrustForTier(state.tier);
    }

    private SourceStatus toStatus(SourceState state) {
        synchronized (state) {
            return SourceStatus.builder()
                    .sourceId(state.id)
                    .name(state.name)
                    .tier(state.tier)
                    .baseTrust(resolveTrust(state))
                    .active(state.active)
                    .consecutiveFailures(state.consecutiveFailures)
                    .lastCrawled(state.lastCrawled)
                    .lastSuccess(state.lastSuccess)
                    .build();
        }
    }

    private static final class SourceState {
        private final String id;
        private final String name;
        private final SourceTier tier;
        private final Double baseTrust;
        private boolean active;
        private int consecutiveFailures;
        private Instant lastCrawled;
        private Instant lastSuccess;

        private SourceState(String id, String name, SourceTier tier, Double baseTrust, boolean active) {
            this.id = id;
            this.name = name;
            this.tier = tier;
            this.baseTrust = baseTrust;
            this.active = active;
        }

        static SourceState from(String id, SourceDefinition definition) {
            SourceTier tier = definition.getTier() != null ? definition.getTier() : SourceTier.TIER3;
            return new SourceState(id, definition.getName(), tier, definition.getBaseTrust(), definition.isActive());
        }

        synchronized boolean isUsable() {
            return active && tier != SourceTier.BLACKLIST;
        }
    }
}
