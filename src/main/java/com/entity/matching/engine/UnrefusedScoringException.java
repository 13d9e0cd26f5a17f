package com.entity.matching.engine;

/**
 * Thrown when the configured scorer refuses to score a pair and nothing falls back to
 * another scorer. This happens when a refusing scorer such as
 * {@link com.entity.matching.scoring.AbsoluteScorer} is used without a combining scorer.
 */
public class UnrefusedScoringException extends IllegalStateException {

    public UnrefusedScoringException(Object keyA, Object keyB, String reason) {
        super("Scorer refused to score pair (" + keyA + ", " + keyB + "): " + reason
                + ". Wrap refusing scorers in a MaxScorer or MinScorer.");
    }
}
