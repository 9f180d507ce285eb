package com.astroplatform.common.lunar;

import com.astroplatform.common.model.LunarPhase;
import com.astroplatform.common.model.LunarPhaseName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LunarPhaseClassifierTest {

    @Nested
    @DisplayName("classify(): bucket boundaries")
    class ClassifyTests {

        @Test
        @DisplayName("0° → new")
        void zero() {
            assertEquals(LunarPhaseName.NEW, LunarPhaseClassifier.classify(0.0));
        }

        @Test
        @DisplayName("44.999° → new")
        void justBelow45() {
            assertEquals(LunarPhaseName.NEW, LunarPhaseClassifier.classify(44.999));
        }

        @Test
        @DisplayName("45.0° → waxing crescent (lower edge inclusive)")
        void exactly45() {
            assertEquals(LunarPhaseName.WAXING_CRESCENT, LunarPhaseClassifier.classify(45.0));
        }

        @Test
        @DisplayName("180.0° → full")
        void full() {
            assertEquals(LunarPhaseName.FULL, LunarPhaseClassifier.classify(180.0));
        }

        @Test
        @DisplayName("359.999° → waning crescent")
        void justBelow360() {
            assertEquals(LunarPhaseName.WANING_CRESCENT, LunarPhaseClassifier.classify(359.999));
        }

        @Test
        @DisplayName("every bucket lower edge maps to its own phase")
        void allLowerEdges() {
            LunarPhaseName[] names = LunarPhaseName.values();
            for (int i = 0; i < names.length; i++) {
                assertEquals(names[i], LunarPhaseClassifier.classify(i * 45.0), "edge " + i * 45.0);
            }
        }
    }

    @Nested
    @DisplayName("phaseAngle() and compute()")
    class ComputeTests {

        @Test
        @DisplayName("Moon behind Sun across 0° → small positive angle")
        void wrapsAcrossZero() {
            assertEquals(20.0, LunarPhaseClassifier.phaseAngle(350, 10), 1e-9);
        }

        @Test
        @DisplayName("Moon before Sun → angle near 360")
        void moonBeforeSun() {
            assertEquals(340.0, LunarPhaseClassifier.phaseAngle(10, 350), 1e-9);
        }

        @Test
        @DisplayName("Sun 100°, Moon 280° → full, 100% illuminated")
        void fullMoon() {
            LunarPhase phase = LunarPhaseClassifier.compute(100, 280);
            assertEquals(180.0, phase.phaseAngle(), 1e-9);
            assertEquals(LunarPhaseName.FULL, phase.phaseName());
            assertEquals(100.0, phase.illuminationPercent(), 1e-9);
        }

        @Test
        @DisplayName("illumination 0 at new, 50 at quarters")
        void illumination() {
            assertEquals(0.0, LunarPhaseClassifier.illuminationPercent(0.0), 1e-9);
            assertEquals(50.0, LunarPhaseClassifier.illuminationPercent(90.0), 1e-9);
            assertEquals(50.0, LunarPhaseClassifier.illuminationPercent(270.0), 1e-9);
        }
    }
}
