package com.newsrank.ranking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * NewsRank Ranking Service Application
 *
 * 수집된 뉴스 배치를 받아 중복 제거 → 무결성 평가 → 신뢰도/품질/인기도 점수 →
 * 프리셋 가중 랭킹을 수행하는 서비스
 * - 결정적(deterministic) Top-N 결과
 * - 소스 다양성 보장
 */
@SpringBootApplication
public class RankingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RankingServiceApplication.class, args);
    }
}
