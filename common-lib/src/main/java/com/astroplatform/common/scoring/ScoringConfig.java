package com.astroplatform.common.scoring;

import com.astroplatform.common.exception.EngineConfigurationException;
import com.astroplatform.common.model.AspectType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Tuning for {@link SignificanceScorer}. Validated on construction: an invalid value fails
 * with {@link EngineConfigurationException} while the engine is being wired.
 *
 * @param baseScore               neutral starting score, in [0, 100]
 * @param majorAspects            aspect types that move the score; never empty
 * @param weights                 maximum contribution per aspect type, each {@code >= 0}
 * @param phaseVolatilityBonus    added to the adjustment magnitude on new and full moons
 * @param bullishThreshold        score at or above which the outlook is bullish
 * @param bearishThreshold        score at or below which the outlook is bearish
 * @param notableOrb              aspects closer than this (°) are listed as events
 * @param hardAspectMargin        hard aspects exceeding harmonious ones by more than this flag volatility
 * @param includeIngressEvents    list bodies within 1° of a sign boundary
 * @param includeRetrogradeEvents list retrograde bodies
 */
public record ScoringConfig(
    double baseScore,
    Set<AspectType> majorAspects,
    Map<AspectType, Double> weights,
    double phaseVolatilityBonus,
    double bullishThreshold,
    double bearishThreshold,
    double notableOrb,
    int hardAspectMargin,
    boolean includeIngressEvents,
    boolean includeRetrogradeEvents
) {
    private static final String COMPONENT = "SignificanceScorer";

    public ScoringConfig {
        requireRange("baseScore", baseScore, 0.0, 100.0);
        requireRange("bullishThreshold", bullishThreshold, 0.0, 100.0);
        requireRange("bearishThreshold", bearishThreshold, 0.0, 100.0);
        if (bearishThreshold >= bullishThreshold) {
            throw new EngineConfigurationException(COMPONENT,
                "bearishThreshold (" + bearishThreshold + ") must be below bullishThreshold (" + bullishThreshold + ")");
        }
        if (majorAspects == null || majorAspects.isEmpty()) {
            throw new EngineConfigurationException(COMPONENT, "at least one major aspect type is required");
        }
        if (weights == null) {
            throw new EngineConfigurationException(COMPONENT, "weights are required");
        }
        for (AspectType type : majorAspects) {
            Double w = weights.get(type);
            if (w == null) {
                throw new EngineConfigurationException(COMPONENT, "missing weight for major aspect " + type.label());
            }
        }
        for (Map.Entry<AspectType, Double> e : weights.entrySet()) {
            requireNonNegative("weight[" + e.getKey().label() + "]", e.getValue());
        }
        requireNonNegative("phaseVolatilityBonus", phaseVolatilityBonus);
        requireNonNegative("notableOrb", notableOrb);
        if (hardAspectMargin < 0) {
            throw new EngineConfigurationException(COMPONENT, "hardAspectMargin must be >= 0, got " + hardAspectMargin);
        }

        majorAspects = Collections.unmodifiableSet(EnumSet.copyOf(majorAspects));
        weights      = Collections.unmodifiableMap(new EnumMap<>(weights));
    }

    public static ScoringConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double weight(AspectType type) {
        return weights.getOrDefault(type, 0.0);
    }

    public boolean isMajor(AspectType type) {
        return majorAspects.contains(type);
    }

    private static void requireRange(String name, double value, double min, double max) {
        if (!(value >= min && value <= max)) {
            throw new EngineConfigurationException(COMPONENT,
                name + " must be in [" + min + ", " + max + "], got " + value);
        }
    }

    private static void requireNonNegative(String name, Double value) {
        if (value == null || !(value >= 0.0) || value.isInfinite()) {
            throw new EngineConfigurationException(COMPONENT, name + " must be a finite value >= 0, got " + value);
        }
    }

    public static final class Builder {
        private double baseScore = 50.0;
        private Set<AspectType> majorAspects =
            EnumSet.of(AspectType.CONJUNCTION, AspectType.OPPOSITION, AspectType.SQUARE);
        private final Map<AspectType, Double> weights = new EnumMap<>(Map.of(
            AspectType.CONJUNCTION, 6.0,
            AspectType.SEXTILE,     4.0,
            AspectType.SQUARE,      8.0,
            AspectType.TRINE,       6.0,
            AspectType.OPPOSITION,  8.0
        ));
        private double phaseVolatilityBonus = 5.0;
        private double bullishThreshold = 70.0;
        private double bearishThreshold = 30.0;
        private double notableOrb = 1.0;
        private int hardAspectMargin = 2;
        private boolean includeIngressEvents = false;
        private boolean includeRetrogradeEvents = false;

        private Builder() {}

        public Builder baseScore(double baseScore) {
            this.baseScore = baseScore;
            return this;
        }

        public Builder majorAspects(Set<AspectType> majorAspects) {
            this.majorAspects = majorAspects;
            return this;
        }

        public Builder weight(AspectType type, double weight) {
            this.weights.put(type, weight);
            return this;
        }

        public Builder phaseVolatilityBonus(double bonus) {
            this.phaseVolatilityBonus = bonus;
            return this;
        }

        public Builder bullishThreshold(double threshold) {
            this.bullishThreshold = threshold;
            return this;
        }

        public Builder bearishThreshold(double threshold) {
            this.bearishThreshold = threshold;
            return this;
        }

        public Builder notableOrb(double notableOrb) {
            this.notableOrb = notableOrb;
            return this;
        }

        public Builder hardAspectMargin(int margin) {
            this.hardAspectMargin = margin;
            return this;
        }

        public Builder includeIngressEvents(boolean include) {
            this.includeIngressEvents = include;
            return this;
        }

        public Builder includeRetrogradeEvents(boolean include) {
            this.includeRetrogradeEvents = include;
            return this;
        }

        public ScoringConfig build() {
            return new ScoringConfig(baseScore, majorAspects, weights, phaseVolatilityBonus,
                bullishThreshold, bearishThreshold, notableOrb, hardAspectMargin,
                includeIngressEvents, includeRetrogradeEvents);
        }
    }
}
