package com.newsrank.ranking.service.registry;

import com.newsrank.ranking.entity.SourceTrust;

import java.util.Optional;

/**
 * 랭킹 코어가 사용하는 읽기 전용 소스 신뢰도 조회 인터페이스
 */
public interface SourceTrustLookup {

    /**
     * @param sourceId 소스 ID
     * @return 등록된 소스의 신뢰도, 미등록이면 empty
     */
    Optional<SourceTrust> find(String sourceId);
}
