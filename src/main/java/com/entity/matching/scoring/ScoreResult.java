package com.entity.matching.scoring;

/**
 * Outcome of scoring one pair: either a score between 0.0 and 1.0, or a refusal
 * meaning the scorer cannot judge this pair and another scorer should decide.
 *
 * <p>Refusals are not errors. Combining scorers such as {@link MaxScorer} skip them;
 * a refusal that reaches the matching engine is a configuration mistake.</p>
 */
public record ScoreResult(double score, String refusalReason) {

    public ScoreResult {
        if (refusalReason == null && (score < 0.0 || score > 1.0 || Double.isNaN(score))) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
    }

    public static ScoreResult of(double score) {
        return new ScoreResult(score, null);
    }

    public static ScoreResult refuse(String reason) {
        return new ScoreResult(Double.NaN, reason);
    }

    public boolean isRefused() {
        return refusalReason != null;
    }

    /**
     * Returns the score.
     *
     * @throws IllegalStateException if this result is a refusal
     */
    @Override
    public double score() {
        if (isRefused()) {
            throw new IllegalStateException("Scorer refused to score: " + refusalReason);
        }
        return score;
    }

    @Override
    public String toString() {
        return isRefused() ? "ScoreResult{refused=" + refusalReason + '}' : "ScoreResult{score=" + score + '}';
    }
}
