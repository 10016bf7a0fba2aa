package com.newsrank.ranking.controller;

import com.newsrank.ranking.dto.RankingPreset;
import com.newsrank.ranking.dto.RankingRequest;
import com.newsrank.ranking.dto.RankingResponse;
import com.newsrank.ranking.service.RankingPipelineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rankings")
@RequiredArgsConstructor
public class RankingController {

    private final RankingPipelineService rankingPipelineService;

    /**
     * POST /api/v1/rankings - 정규화된 기사 배치를 중복 제거 후 랭킹
     */
    @PostMapping
    public ResponseEntity<RankingResponse> rank(@Valid @RequestBody RankingRequest request) {
        return ResponseEntity.ok(rankingPipelineService.rank(request));
    }

    /**
     * GET /api/v1/rankings/presets - 설정된 랭킹 프리셋 목록
     */
    @GetMapping("/presets")
    public ResponseEntity<List<RankingPreset>> listPresets() {
        return ResponseEntity.ok(rankingPipelineService.getPresets());
    }
}
