package com.astroplatform.common.direction;

import com.astroplatform.common.exception.EngineConfigurationException;
import com.astroplatform.common.model.AspectDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * One-step finite-difference classification of applying / separating / stationary aspects.
 */
class DirectionClassifierTest {

    private final DirectionClassifier classifier = new DirectionClassifier();

    @Test
    @DisplayName("faster body closing on a conjunction → APPLYING")
    void closingConjunction() {
        assertEquals(AspectDirection.APPLYING, classifier.classify(0, 1.0, 5, 0.0, 0));
    }

    @Test
    @DisplayName("faster body moving past a conjunction → SEPARATING")
    void leavingConjunction() {
        assertEquals(AspectDirection.SEPARATING, classifier.classify(5, 1.0, 0, 0.0, 0));
    }

    @Test
    @DisplayName("relative speed below epsilon → STATIONARY")
    void belowEpsilon() {
        assertEquals(AspectDirection.STATIONARY, classifier.classify(0, 1.0, 5, 0.995, 0));
    }

    @Test
    @DisplayName("opposition approached across the 0° boundary → APPLYING")
    void oppositionAcrossWrap() {
        // separation 175° now, 176° after one day
        assertEquals(AspectDirection.APPLYING, classifier.classify(350, 1.0, 175, 0.0, 180));
    }

    @Test
    @DisplayName("retrograde body reverses the direction")
    void retrogradeReverses() {
        assertEquals(AspectDirection.SEPARATING, classifier.classify(0, -1.0, 5, 0.0, 0));
    }

    @Test
    @DisplayName("equal distance before and after the step → STATIONARY")
    void equalDistance() {
        // 10° → 11° around a 10.5° target
        assertEquals(AspectDirection.STATIONARY, classifier.classify(10, 1.0, 0, 0.0, 10.5));
    }

    @Test
    @DisplayName("negative epsilon is a configuration error")
    void negativeEpsilon() {
        assertThrows(EngineConfigurationException.class, () -> new DirectionClassifier(-0.1));
    }
}
