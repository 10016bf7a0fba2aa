package com.newsrank.ranking.controller;

import com.newsrank.ranking.dto.RankingPreset;
import com.newsrank.ranking.dto.RankingRequest;
import com.newsrank.ranking.dto.RankingResponse;
import com.newsrank.ranking.dto.SourceStatus;
import com.newsrank.ranking.entity.SourceTier;
import com.newsrank.ranking.exception.SourceNotFoundException;
import com.newsrank.ranking.exception.UnknownPresetException;
import com.newsrank.ranking.service.RankingPipelineService;
import com.newsrank.ranking.service.registry.SourceTrustRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RankingController / SourceTrustController 단위 테스트
 */
@WebFluxTest({RankingController.class, SourceTrustController.class})
@ActiveProfiles("test")
class RankingControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private RankingPipelineService rankingPipelineService;

    @MockBean
    private SourceTrustRegistry sourceTrustRegistry;

    @Nested
    @DisplayName("POST /api/v1/rankings")
    class RankTests {

        @Test
        @DisplayName("정상 요청은 200과 snake_case 응답")
        void rankOk() {
            // given
            when(rankingPipelineService.rank(any(RankingRequest.class))).thenReturn(RankingResponse.builder()
                    .preset("quality")
                    .totalInput(2)
                    .afterUrlDedup(2)
                    .afterTitleDedup(2)
                    .afterClustering(1)
                    .eligibleCount(1)
                    .build());

            // when & then
            webTestClient.post()
                    .uri("/api/v1/rankings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("""
                            {"articles": [
                              {"id": "a1", "source_id": "kbs", "title": "반도체 수출 회복", "body": "본문"},
                              {"id": "a2", "source_id": "mbc", "title": "반도체 수출 회복세", "body": "본문"}
                            ]}
                            """)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.preset").isEqualTo("quality")
                    .jsonPath("$.total_input").isEqualTo(2)
                    .jsonPath("$.after_clustering").isEqualTo(1);
        }

        @Test
        @DisplayName("등록되지 않은 프리셋은 400 UNKNOWN_PRESET")
        void unknownPreset() {
            when(rankingPipelineService.rank(any(RankingRequest.class)))
                    .thenThrow(new UnknownPresetException("bogus", List.of("quality")));

            webTestClient.post()
                    .uri("/api/v1/rankings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"articles\": [], \"preset\": \"bogus\"}")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.error").isEqualTo("UNKNOWN_PRESET")
                    .jsonPath("$.status").isEqualTo(400);
        }

        @Test
        @DisplayName("articles 누락은 400 VALIDATION_ERROR, 파이프라인 미호출")
        void missingArticles() {
            webTestClient.post()
                    .uri("/api/v1/rankings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"preset\": \"quality\"}")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");

            verify(rankingPipelineService, never()).rank(any());
        }

        @Test
        @DisplayName("articles 배열의 null 항목은 400 VALIDATION_ERROR, 파이프라인 미호출")
        void nullArticleEntry() {
            webTestClient.post()
                    .uri("/api/v1/rankings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("""
                            {"articles": [
                              {"id": "a1", "source_id": "kbs", "title": "반도체 수출 회복", "body": "본문"},
                              null
                            ]}
                            """)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("VALIDATION_ERROR")
                    .jsonPath("$.message").value(message -> assertThat((String) message).contains("articles[1]"));

            verify(rankingPipelineService, never()).rank(any());
        }

        @Test
        @DisplayName("GET /api/v1/rankings/presets - 프리셋 목록")
        void presets() {
            when(rankingPipelineService.getPresets())
                    .thenReturn(List.of(new RankingPreset("quality", 0.15, 0.30, 0.40, 0.15)));

            webTestClient.get()
                    .uri("/api/v1/rankings/presets")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$[0].name").isEqualTo("quality");
        }
    }

    @Nested
    @DisplayName("/api/v1/sources/trust")
    class SourceTrustTests {

        @Test
        @DisplayName("등록된 소스 조회는 200")
        void getSource() {
            when(sourceTrustRegistry.getStatus("kbs")).thenReturn(SourceStatus.builder()
                    .sourceId("kbs")
                    .name("KBS")
                    .tier(SourceTier.TIER1)
                    .baseTrust(0.85)
                    .active(true)
                    .build());

            webTestClient.get()
                    .uri("/api/v1/sources/trust/kbs")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.source_id").isEqualTo("kbs")
                    .jsonPath("$.base_trust").isEqualTo(0.85);
        }

        @Test
        @DisplayName("미등록 소스는 404 SOURCE_NOT_FOUND")
        void unknownSource() {
            when(sourceTrustRegistry.getStatus("nope")).thenThrow(new SourceNotFoundException("nope"));

            webTestClient.get()
                    .uri("/api/v1/sources/trust/nope")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("SOURCE_NOT_FOUND");
        }
    }
}
