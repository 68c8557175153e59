package com.creditengine.service.ensemble;

import com.creditengine.model.FeatureSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RuleCascadePredictor Tests")
class RuleCascadePredictorTest {

    private final RuleCascadePredictor predictor = new RuleCascadePredictor();

    @Test
    @DisplayName("No triggered rule leaves the base score")
    void neutralFeaturesKeepBase() {
        assertThat(predictor.predict(PredictorFeatures.neutral())).isEqualTo(500.0);
    }

    @Test
    @DisplayName("Every positive rule together saturates at the top of the scale")
    void allPositiveRulesClampToMax() {
        FeatureSet excellent = new FeatureSet(2, 3, 10_000, 1, 0, 0.9, 2, 0.1, 5, 0, 0, 0, 0);

        assertThat(predictor.predict(excellent)).isEqualTo(900.0);
    }

    @Test
    @DisplayName("Heavy leverage and no savings pull the score down")
    void negativeRules() {
        FeatureSet stretched = new FeatureSet(0.4, 1, 0, 0.5, 0, 0.4, 0.3, 0.8, 0.5, 0, 0, 0, 0);

        assertThat(predictor.predict(stretched)).isEqualTo(500.0 - 80 - 60);
    }

    @ParameterizedTest(name = "payment consistency {0} -> {1}")
    @CsvSource({"0.5, 500", "0.71, 550", "0.85, 550", "0.86, 600", "1.0, 600"})
    void paymentConsistencyTiers(double paymentConsistency, double expected) {
        FeatureSet features = PredictorFeatures.withPaymentConsistency(PredictorFeatures.neutral(), paymentConsistency);

        assertThat(predictor.predict(features)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Raising payment consistency from 0.5 to 0.9 never lowers the score")
    void monotoneInPaymentConsistency() {
        FeatureSet[] bases = {
                PredictorFeatures.neutral(),
                PredictorFeatures.allZero(),
                new FeatureSet(2, 3, 10_000, 0.5, 0, 0.9, 2, 0.1, 5, 0, 0, 0, 0),
                new FeatureSet(0.1, 0.5, 0, 0.5, -5, 0.1, 0.1, 1.2, 0.2, 1, 0.3, 0.6, 0.15)
        };

        for (FeatureSet base : bases) {
            double previous = Double.NEGATIVE_INFINITY;
            for (int step = 0; step <= 40; step++) {
                double paymentConsistency = 0.5 + step * 0.01;
                double score = predictor.predict(PredictorFeatures.withPaymentConsistency(base, paymentConsistency));
                assertThat(score).isGreaterThanOrEqualTo(previous);
                previous = score;
            }
        }
    }
}
