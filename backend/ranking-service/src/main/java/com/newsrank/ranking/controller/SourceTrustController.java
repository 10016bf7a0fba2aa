package com.newsrank.ranking.controller;

import com.newsrank.ranking.dto.SourceRegistryStats;
import com.newsrank.ranking.dto.SourceStatus;
import com.newsrank.ranking.service.registry.SourceTrustRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/sources/trust")
@RequiredArgsConstructor
public class SourceTrustController {

    private final SourceTrustRegistry sourceTrustRegistry;

    /**
     * GET /api/v1/sources/trust - 등록된 소스 전체
     */
    @GetMapping
    public ResponseEntity<List<SourceStatus>> listSources() {
        return ResponseEntity.ok(sourceTrustRegistry.getAll());
    }

    /**
     * GET /api/v1/sources/trust/stats - 레지스트리 통계
     */
    @GetMapping("/stats")
    public ResponseEntity<SourceRegistryStats> getStats() {
        return ResponseEntity.ok(sourceTrustRegistry.getStats());
    }

    /**
     * GET /api/v1/sources/trust/{sourceId} - 소스 신뢰도 및 상태 조회
     */
    @GetMapping("/{sourceId}")
    public ResponseEntity<SourceStatus> getSource(@PathVariable String sourceId) {
        return ResponseEntity.ok(sourceTrustRegistry.getStatus(sourceId));
    }

    /**
     * POST /api/v1/sources/trust/{sourceId}/success - 수집 성공 기록
     */
    @PostMapping("/{sourceId}/success")
    public ResponseEntity<SourceStatus> recordSuccess(@PathVariable String sourceId) {
        return ResponseEntity.ok(sourceTrustRegistry.recordSuccess(sourceId));
    }

    /**
     * POST /api/v1/sources/trust/{sourceId}/failure - 수집 실패 기록
     */
    @PostMapping("/{sourceId}/failure")
    public ResponseEntity<SourceStatus> recordFailure(@PathVariable String sourceId) {
        return ResponseEntity.ok(sourceTrustRegistry.recordFailure(sourceId));
    }

    /**
     * POST /api/v1/sources/trust/{sourceId}/reactivate - 비활성 소스 재활성화
     */
    @PostMapping("/{sourceId}/reactivate")
    public ResponseEntity<Map<String, Object>> reactivate(@PathVariable String sourceId) {
        boolean reactivated = sourceTrustRegistry.reactivate(sourceId);
        return ResponseEntity.ok(Map.of(
                "source_id", sourceId,
                "reactivated", reactivated,
                "status", sourceTrustRegistry.getStatus(sourceId)));
    }
}
