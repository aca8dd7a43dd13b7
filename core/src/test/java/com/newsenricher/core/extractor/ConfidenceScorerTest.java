package com.newsenricher.core.extractor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer(500);

    @Test
    @DisplayName("단어 수가 늘면 점수는 줄지 않고, 정규화 상한 이후엔 그대로")
    void monotonicInWords_andCapped() {
        double prev = -1;
        for (int words = 0; words <= 2000; words += 50) {
            double s = scorer.score(ConfidenceScorer.Weights.ARTICLE, words, "t", "a", "", "");
            assertThat(s).isGreaterThanOrEqualTo(prev);
            prev = s;
        }
        assertThat(scorer.score(ConfidenceScorer.Weights.ARTICLE, 500, "", "", "", ""))
                .isEqualTo(scorer.score(ConfidenceScorer.Weights.ARTICLE, 5000, "", "", "", ""));
    }

    @Test
    @DisplayName("전략별 가중치: 필드 보너스와 description 반영 여부")
    void weights() {
        assertThat(scorer.score(ConfidenceScorer.Weights.STRUCTURED, 250, "t", "a", "d", "x"))
                .isCloseTo(0.3 + 0.4, within(1e-9));
        assertThat(scorer.score(ConfidenceScorer.Weights.ARTICLE, 250, "t", "a", "d", "x"))
                .isCloseTo(0.35 + 0.3, within(1e-9));
        assertThat(scorer.score(ConfidenceScorer.Weights.HEURISTIC, 250, "t", " ", null, "x"))
                .isCloseTo(0.2 + 0.3, within(1e-9));
    }

    @Test
    @DisplayName("점수는 [0, 1]")
    void bounded() {
        assertThat(scorer.score(ConfidenceScorer.Weights.HEURISTIC, 10_000, "t", "a", "d", "x")).isEqualTo(1.0);
        assertThat(scorer.score(ConfidenceScorer.Weights.STRUCTURED, -5, "", "", "", "")).isEqualTo(0.0);
    }
}
