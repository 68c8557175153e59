package com.creditengine.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ScoringProperties Validation Tests")
class ScoringPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    private final ScoringProperties defaults = ScoringProperties.defaults();

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    private Set<ConstraintViolation<ScoringProperties>> validate(ScoringProperties properties) {
        return validator.validate(properties);
    }

    @Test
    @DisplayName("Default table is valid")
    void defaultsAreValid() {
        assertThat(validate(defaults)).isEmpty();
    }

    @Test
    @DisplayName("Weights that do not sum to 1 are rejected")
    void weightsMustBeNormalized() {
        ScoringProperties properties = new ScoringProperties(new ScoringProperties.Ensemble(0.5, 0.35, 0.25),
                defaults.pricing(), defaults.lending(), defaults.regulatory(), defaults.bands(), defaults.batch());

        assertThat(validate(properties))
                .extracting(ConstraintViolation::getMessage)
                .containsExactly("ensemble weights must sum to 1");
    }

    @Test
    @DisplayName("Inverted rate range is rejected")
    void rateRange() {
        ScoringProperties properties = new ScoringProperties(defaults.ensemble(),
                new ScoringProperties.Pricing(12, 26, 10),
                defaults.lending(), defaults.regulatory(), defaults.bands(), defaults.batch());

        assertThat(validate(properties))
                .extracting(ConstraintViolation::getMessage)
                .containsExactly("minRate must not exceed maxRate");
    }

    @Test
    @DisplayName("Unordered band boundaries are rejected")
    void bandOrder() {
        ScoringProperties properties = new ScoringProperties(defaults.ensemble(), defaults.pricing(),
                defaults.lending(), defaults.regulatory(), new ScoringProperties.Bands(650, 750, 550, 450),
                defaults.batch());

        assertThat(validate(properties))
                .extracting(ConstraintViolation::getMessage)
                .containsExactly("band boundaries must be strictly descending");
    }

    @Test
    @DisplayName("Zero concurrency and negative caps are rejected")
    void numericBounds() {
        ScoringProperties properties = new ScoringProperties(defaults.ensemble(), defaults.pricing(),
                defaults.lending(), new ScoringProperties.Regulatory(-1, 26, 5_000, 50),
                defaults.bands(), new ScoringProperties.Batch(0));

        assertThat(validate(properties))
                .extracting(violation -> violation.getPropertyPath().toString())
                .containsExactlyInAnyOrder("regulatory.loanCap", "batch.concurrency");
    }

    @Test
    @DisplayName("Missing sections are rejected")
    void missingSection() {
        ScoringProperties properties = new ScoringProperties(defaults.ensemble(), null,
                defaults.lending(), defaults.regulatory(), defaults.bands(), defaults.batch());

        assertThat(validate(properties))
                .extracting(violation -> violation.getPropertyPath().toString())
                .containsExactly("pricing");
    }
}
