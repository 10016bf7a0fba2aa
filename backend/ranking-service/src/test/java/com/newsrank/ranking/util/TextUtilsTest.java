package com.newsrank.ranking.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * TextUtils 단위 테스트
 */
class TextUtilsTest {

    @Nested
    @DisplayName("Jaccard 유사도")
    class JaccardTests {

        @Test
        @DisplayName("대소문자를 무시한 공백 토큰 기준으로 계산한다")
        void caseInsensitiveTokens() {
            assertThat(TextUtils.jaccard("Samsung Galaxy Launch", "samsung galaxy event"))
                    .isCloseTo(2.0 / 4.0, within(1e-9));
        }

        @Test
        @DisplayName("한쪽이라도 비어 있으면 0")
        void emptySetIsZero() {
            assertThat(TextUtils.jaccard(Set.of(), Set.of("a"))).isZero();
            assertThat(TextUtils.jaccard("", "")).isZero();
        }

        @Test
        @DisplayName("6개 공유, 합집합 10개 토큰이면 정확히 0.6")
        void exactThreshold() {
            String left = "t1 t2 t3 t4 t5 t6 t7 t8";
            String right = "t1 t2 t3 t4 t5 t6 t7 t8 t9 t10";
            assertThat(TextUtils.jaccard(left, right)).isCloseTo(0.8, within(1e-9));
            assertThat(TextUtils.jaccard("t1 t2 t3 t4 t5 t6 t7 t8", "t3 t4 t5 t6 t7 t8 t9 t10"))
                    .isEqualTo(0.6);
        }
    }

    @Test
    @DisplayName("제목 정규화는 공백을 축약하고 소문자로 바꾼다")
    void normalizeTitle() {
        assertThat(TextUtils.normalizeTitle("  Breaking   NEWS\tToday "))
                .isEqualTo("breaking news today");
    }

    @Test
    @DisplayName("문단은 빈 줄을 제외한다")
    void paragraphs() {
        assertThat(TextUtils.paragraphs("첫 문단\n\n  \n둘째 문단\r\n셋째"))
                .containsExactly("첫 문단", "둘째 문단", "셋째");
    }

    @Test
    @DisplayName("키워드는 3자 이상이며 불용어를 제외한다")
    void keywords() {
        assertThat(TextUtils.keywords("The market and economy is growing", Set.of("the", "and", "is")))
                .containsExactlyInAnyOrder("market", "economy", "growing");
    }

    @Test
    @DisplayName("소수 둘째 자리 반올림")
    void round() {
        assertThat(TextUtils.round(68.00000000000001, 2)).isEqualTo(68.0);
        assertThat(TextUtils.round(12.346, 2)).isEqualTo(12.35);
    }
}
