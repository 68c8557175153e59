package com.creditengine.service.ensemble;

import com.creditengine.config.ScoringConstants;
import com.creditengine.model.FeatureSet;
import org.springframework.stereotype.Component;

/**
 * Two rectified-linear layers over the feature vector, reduced by a weighted
 * sum and mapped onto the score scale as {@code 500 + output * 200}.
 *
 * Each layer adds a constant bias equal to the mean of the per-call random
 * draw the scorer used to make (uniform on [0, 0.1) and [0, 0.05)).
 */
@Component
public class LayeredWeightedPredictor implements ScorePredictor {

    static final double FIRST_LAYER_WEIGHT = 0.1;
    static final double FIRST_LAYER_BIAS = 0.05;
    static final double SECOND_LAYER_WEIGHT = 0.2;
    static final double SECOND_LAYER_BIAS = 0.025;
    static final double OUTPUT_WEIGHT = 0.3;

    static final double BASE_SCORE = 500;
    static final double OUTPUT_SCALE = 200;

    @Override
    public String name() {
        return "layered-weighted";
    }

    @Override
    public double predict(FeatureSet features) {
        double output = 0;
        for (double input : features.toVector()) {
            double hidden1 = relu(input * FIRST_LAYER_WEIGHT + FIRST_LAYER_BIAS);
            double hidden2 = relu(hidden1 * SECOND_LAYER_WEIGHT + SECOND_LAYER_BIAS);
            output += hidden2 * OUTPUT_WEIGHT;
        }

        return ScoringConstants.clampScore(BASE_SCORE + output * OUTPUT_SCALE);
    }

    private static double relu(double x) {
        return Math.max(0, x);
    }
}
