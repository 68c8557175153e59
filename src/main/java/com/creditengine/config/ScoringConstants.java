package com.creditengine.config;

/**
 * Fixed bounds of the scoring model.
 *
 * These are properties of the score scale itself, not tunable policy, so they
 * live here rather than in {@link ScoringProperties}.
 */
public class ScoringConstants {

    // Credit score scale
    public static final int MIN_SCORE = 300;
    public static final int MAX_SCORE = 900;

    // Reported prediction accuracy never leaves this band
    public static final double MIN_PREDICTION_ACCURACY = 0.65;
    public static final double MAX_PREDICTION_ACCURACY = 0.95;

    // Confidence above this counts as a high-confidence prediction
    public static final double HIGH_CONFIDENCE_THRESHOLD = 0.8;

    // Private constructor to prevent instantiation
    private ScoringConstants() {
    }

    public static int clampScore(long score) {
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    public static double clampScore(double score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
