package com.astroplatform.common.scoring;

import com.astroplatform.common.aspect.OrbTable;
import com.astroplatform.common.exception.EngineConfigurationException;
import com.astroplatform.common.lunar.LunarPhaseClassifier;
import com.astroplatform.common.model.AspectDirection;
import com.astroplatform.common.model.AspectRecord;
import com.astroplatform.common.model.AspectType;
import com.astroplatform.common.model.BodyPosition;
import com.astroplatform.common.model.CelestialBody;
import com.astroplatform.common.model.LunarPhase;
import com.astroplatform.common.model.MarketOutlook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignificanceScorerTest {

    private final SignificanceScorer scorer = new SignificanceScorer();

    private static final LunarPhase FULL_MOON = LunarPhaseClassifier.compute(100, 280);
    private static final LunarPhase FIRST_QUARTER = LunarPhaseClassifier.compute(0, 100);

    private static AspectRecord aspect(CelestialBody a, CelestialBody b, AspectType type, double delta) {
        return AspectRecord.of(a, b, type, type.angle() + delta, delta, true,
                               delta < 0.1, 1.0 - delta / type.defaultOrb(), AspectDirection.APPLYING);
    }

    // ── score ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("score(): daily score")
    class ScoreTests {

        @Test
        @DisplayName("no aspects, no phase → neutral base")
        void empty() {
            SignificanceResult r = scorer.score(List.of(), null, List.of());
            assertEquals(50.0, r.dailyScore());
            assertEquals(MarketOutlook.NEUTRAL, r.marketOutlook());
            assertTrue(r.significantEvents().isEmpty());
        }

        @Test
        @DisplayName("no aspects on a full moon → base plus the phase bonus, volatile outlook")
        void phaseOnly() {
            SignificanceResult r = scorer.score(List.of(), FULL_MOON, List.of());
            assertEquals(55.0, r.dailyScore());
            assertEquals(0.0, r.aspectAdjustment(), 1e-9);
            assertTrue(r.volatileDay());
            assertEquals(MarketOutlook.VOLATILE, r.marketOutlook());
            assertEquals(List.of("Full Moon"), r.significantEvents());
        }

        @Test
        @DisplayName("no aspects on a new moon → bonus applied even though nothing else scored")
        void phaseOnlyNewMoon() {
            LunarPhase newMoon = LunarPhaseClassifier.compute(100, 102);
            SignificanceResult withPhase = scorer.score(List.of(), newMoon, List.of());
            SignificanceResult withoutPhase = scorer.score(List.of(), null, List.of());
            assertNotEquals(withoutPhase.dailyScore(), withPhase.dailyScore());
            assertEquals(55.0, withPhase.dailyScore());
            assertEquals(List.of("New Moon"), withPhase.significantEvents());
        }

        @Test
        @DisplayName("exact opposition pulls the score down by its full weight")
        void exactOpposition() {
            SignificanceResult r = scorer.score(
                List.of(aspect(CelestialBody.SUN, CelestialBody.MOON, AspectType.OPPOSITION, 0.0)),
                FIRST_QUARTER, List.of());
            assertEquals(42.0, r.dailyScore());
            assertEquals(-8.0, r.aspectAdjustment(), 1e-9);
        }

        @Test
        @DisplayName("full moon widens the adjustment without flipping its sign")
        void phaseBonusKeepsSign() {
            SignificanceResult r = scorer.score(
                List.of(aspect(CelestialBody.SUN, CelestialBody.MOON, AspectType.OPPOSITION, 0.0)),
                FULL_MOON, List.of());
            assertEquals(37.0, r.dailyScore());
            assertEquals(MarketOutlook.VOLATILE, r.marketOutlook());
        }

        @Test
        @DisplayName("aspect halfway through its orb contributes half its weight")
        void closenessScaling() {
            SignificanceResult r = scorer.score(
                List.of(aspect(CelestialBody.MARS, CelestialBody.SATURN, AspectType.SQUARE, 4.0)),
                null, List.of());
            assertEquals(46.0, r.dailyScore());
        }

        @Test
        @DisplayName("non-major aspect types do not move the score")
        void minorIgnored() {
            SignificanceResult r = scorer.score(
                List.of(aspect(CelestialBody.VENUS, CelestialBody.JUPITER, AspectType.TRINE, 0.0)),
                null, List.of());
            assertEquals(50.0, r.dailyScore());
        }

        @Test
        @DisplayName("harmonious majors above the bullish threshold → BULLISH")
        void bullish() {
            SignificanceScorer harmonious = new SignificanceScorer(
                ScoringConfig.builder()
                    .majorAspects(EnumSet.of(AspectType.TRINE, AspectType.SEXTILE))
                    .build(),
                OrbTable.defaults());
            List<AspectRecord> trines = List.of(
                aspect(CelestialBody.SUN, CelestialBody.JUPITER, AspectType.TRINE, 0.0),
                aspect(CelestialBody.MOON, CelestialBody.VENUS, AspectType.TRINE, 0.0),
                aspect(CelestialBody.MERCURY, CelestialBody.SATURN, AspectType.TRINE, 0.0),
                aspect(CelestialBody.MARS, CelestialBody.URANUS, AspectType.TRINE, 0.0));

            SignificanceResult r = harmonious.score(trines, FIRST_QUARTER, List.of());
            assertEquals(74.0, r.dailyScore());
            assertEquals(MarketOutlook.BULLISH, r.marketOutlook());
        }

        @Test
        @DisplayName("adjustment is capped so the score never leaves [0,100]")
        void capped() {
            List<AspectRecord> many = new ArrayList<>();
            CelestialBody[] bodies = CelestialBody.values();
            for (int i = 1; i < bodies.length; i++) {
                many.add(aspect(CelestialBody.SUN, bodies[i], AspectType.OPPOSITION, 0.0));
            }
            many.add(aspect(CelestialBody.MOON, CelestialBody.MARS, AspectType.OPPOSITION, 0.0));

            SignificanceResult r = scorer.score(many, FULL_MOON, List.of());
            assertEquals(0.0, r.dailyScore());
            assertEquals(MarketOutlook.BEARISH, r.marketOutlook());
        }

        @Test
        @DisplayName("hard aspects outnumbering harmonious ones → volatile without a phase")
        void hardImbalance() {
            List<AspectRecord> squares = List.of(
                aspect(CelestialBody.SUN, CelestialBody.MARS, AspectType.SQUARE, 8.0),
                aspect(CelestialBody.MOON, CelestialBody.SATURN, AspectType.SQUARE, 8.0),
                aspect(CelestialBody.VENUS, CelestialBody.PLUTO, AspectType.SQUARE, 8.0));

            SignificanceResult r = scorer.score(squares, FIRST_QUARTER, List.of());
            assertEquals(50.0, r.dailyScore());
            assertEquals(MarketOutlook.VOLATILE, r.marketOutlook());
        }
    }

    // ── resolveOutlook ────────────────────────────────────────────────────

    @Nested
    @DisplayName("resolveOutlook(): pure threshold rule")
    class OutlookTests {

        @Test
        @DisplayName("thresholds are inclusive and take precedence over volatility")
        void thresholds() {
            assertEquals(MarketOutlook.BULLISH, scorer.resolveOutlook(70.0, false));
            assertEquals(MarketOutlook.BULLISH, scorer.resolveOutlook(85.0, true));
            assertEquals(MarketOutlook.BEARISH, scorer.resolveOutlook(30.0, true));
            assertEquals(MarketOutlook.VOLATILE, scorer.resolveOutlook(50.0, true));
            assertEquals(MarketOutlook.NEUTRAL, scorer.resolveOutlook(50.0, false));
        }
    }

    // ── events ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("significantEvents()")
    class EventTests {

        @Test
        @DisplayName("exact and notable aspects listed in order, then the phase event")
        void ordering() {
            List<AspectRecord> aspects = List.of(
                aspect(CelestialBody.SUN, CelestialBody.MOON, AspectType.OPPOSITION, 0.0),
                aspect(CelestialBody.MARS, CelestialBody.SATURN, AspectType.SQUARE, 2.0),
                aspect(CelestialBody.VENUS, CelestialBody.JUPITER, AspectType.TRINE, 0.5));

            SignificanceResult r = scorer.score(aspects, FULL_MOON, List.of());
            assertEquals(List.of("Sun opposition Moon", "Venus trine Jupiter", "Full Moon"), r.significantEvents());
        }

        @Test
        @DisplayName("duplicate event strings are collapsed")
        void deduplicated() {
            AspectRecord a = aspect(CelestialBody.SUN, CelestialBody.MOON, AspectType.OPPOSITION, 0.0);
            List<String> events = scorer.significantEvents(List.of(a, a), null, List.of());
            assertEquals(List.of("Sun opposition Moon"), events);
        }

        @Test
        @DisplayName("ingress and retrograde events appended when enabled")
        void ingressAndRetrograde() {
            SignificanceScorer verbose = new SignificanceScorer(
                ScoringConfig.builder().includeIngressEvents(true).includeRetrogradeEvents(true).build(),
                OrbTable.defaults());
            List<BodyPosition> positions = List.of(
                BodyPosition.of(CelestialBody.MERCURY, 75.0, -0.4),
                BodyPosition.of(CelestialBody.VENUS, 59.5, 1.1),
                BodyPosition.of(CelestialBody.MARS, 30.5, 0.6));

            SignificanceResult r = verbose.score(List.of(), null, positions);
            assertEquals(List.of("Venus leaving Taurus", "Mars entering Taurus", "Mercury retrograde"),
                         r.significantEvents());
        }
    }

    // ── configuration ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("ScoringConfig validation")
    class ConfigTests {

        @Test
        @DisplayName("missing config or orb table → configuration error")
        void missingCollaborators() {
            assertThrows(EngineConfigurationException.class, () -> new SignificanceScorer(null, OrbTable.defaults()));
            assertThrows(EngineConfigurationException.class,
                () -> new SignificanceScorer(ScoringConfig.defaults(), null));
        }

        @Test
        @DisplayName("bearish threshold not below bullish → configuration error")
        void invertedThresholds() {
            assertThrows(EngineConfigurationException.class,
                () -> ScoringConfig.builder().bearishThreshold(70).bullishThreshold(60).build());
        }

        @Test
        @DisplayName("base score outside [0,100] → configuration error")
        void baseOutOfRange() {
            assertThrows(EngineConfigurationException.class, () -> ScoringConfig.builder().baseScore(120).build());
        }

        @Test
        @DisplayName("no major aspects → configuration error")
        void emptyMajors() {
            assertThrows(EngineConfigurationException.class,
                () -> ScoringConfig.builder().majorAspects(EnumSet.noneOf(AspectType.class)).build());
        }

        @Test
        @DisplayName("negative weight → configuration error")
        void negativeWeight() {
            assertThrows(EngineConfigurationException.class,
                () -> ScoringConfig.builder().weight(AspectType.SQUARE, -1.0).build());
        }
    }
}
