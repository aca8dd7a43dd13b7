package com.newsenricher.core.extractor;

/**
 * confidence = min(1, min(words/wordNorm, 1)·wordWeight + fieldBonus × 채워진 필드 수).
 * 같은 가중치에서 단어 수가 많을수록(상한까지) 점수는 줄지 않는다.
 */
public final class ConfidenceScorer {

    /** 전략별 가중치 */
    public record Weights(double wordWeight, double fieldBonus, boolean countsDescription) {
        public static final Weights STRUCTURED = new Weights(0.6, 0.1, true);
        public static final Weights ARTICLE    = new Weights(0.7, 0.1, false);
        public static final Weights HEURISTIC  = new Weights(0.4, 0.15, true);
    }

    private final int wordNorm;

    public ConfidenceScorer(int wordNorm) {
        this.wordNorm = Math.max(1, wordNorm);
    }

    public double score(Weights w, int words, String title, String author, String date, String description) {
        double ratio = Math.min(1.0, Math.max(0, words) / (double) wordNorm);
        int fields = present(title) + present(author) + present(date);
        if (w.countsDescription()) fields += present(description);
        return Math.min(1.0, ratio * w.wordWeight() + fields * w.fieldBonus());
    }

    public int wordNorm() { return wordNorm; }

    private static int present(String s) {
        return (s != null && !s.isBlank()) ? 1 : 0;
    }
}
