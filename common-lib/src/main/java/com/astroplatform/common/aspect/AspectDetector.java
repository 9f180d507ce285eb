package com.astroplatform.common.aspect;

import com.astroplatform.common.angle.AngleMath;
import com.astroplatform.common.angle.OrbMatch;
import com.astroplatform.common.direction.DirectionClassifier;
import com.astroplatform.common.exception.EngineConfigurationException;
import com.astroplatform.common.model.AspectDirection;
import com.astroplatform.common.model.AspectRecord;
import com.astroplatform.common.model.AspectType;
import com.astroplatform.common.model.BodyPosition;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds every aspect formed between a set of body positions.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Enumerate the {@code N·(N−1)/2} unordered pairs in input order.</li>
 *   <li>Test each pair against every {@link AspectType} with
 *       {@link AngleMath#orbMatch(double, double, double, double)} using the orb from the
 *       {@link OrbTable}.</li>
 *   <li>Keep at most one match per pair: the smallest delta, the earlier aspect type on a tie.</li>
 *   <li>Mark the record exact when its delta is below {@code exactEpsilon} and attach the
 *       direction from {@link DirectionClassifier}.</li>
 * </ol>
 *
 * <p>An empty result is valid. Stateless and thread-safe.
 */
public final class AspectDetector {

    /** Delta (°) below which an aspect counts as exact. */
    public static final double DEFAULT_EXACT_EPSILON = 0.1;

    private final OrbTable orbTable;
    private final double exactEpsilon;
    private final DirectionClassifier directionClassifier;

    public AspectDetector() {
        this(OrbTable.defaults(), DEFAULT_EXACT_EPSILON, new DirectionClassifier());
    }

    public AspectDetector(OrbTable orbTable, double exactEpsilon, DirectionClassifier directionClassifier) {
        if (orbTable == null || directionClassifier == null) {
            throw new EngineConfigurationException("AspectDetector", "orbTable and directionClassifier are required");
        }
        if (!(exactEpsilon >= 0.0) || Double.isInfinite(exactEpsilon)) {
            throw new EngineConfigurationException("AspectDetector",
                "exactEpsilon must be a finite value >= 0, got " + exactEpsilon);
        }
        this.orbTable = orbTable;
        this.exactEpsilon = exactEpsilon;
        this.directionClassifier = directionClassifier;
    }

    public List<AspectRecord> detect(List<BodyPosition> positions) {
        List<AspectRecord> aspects = new ArrayList<>();
        if (positions == null || positions.size() < 2) {
            return aspects;
        }

        for (int i = 0; i < positions.size(); i++) {
            for (int j = i + 1; j < positions.size(); j++) {
                BodyPosition a = positions.get(i);
                BodyPosition b = positions.get(j);
                if (a.body() == b.body()) {
                    throw new IllegalArgumentException("duplicate position for " + a.body());
                }
                AspectRecord best = bestMatch(a, b);
                if (best != null) {
                    aspects.add(best);
                }
            }
        }
        return aspects;
    }

    /** Closest aspect within orb for one pair, or {@code null} if none. */
    AspectRecord bestMatch(BodyPosition a, BodyPosition b) {
        AspectType bestType = null;
        double bestDelta = Double.MAX_VALUE;

        for (AspectType type : AspectType.values()) {
            OrbMatch match = AngleMath.orbMatch(a.longitude(), b.longitude(), type.angle(), orbTable.orbFor(type));
            if (match.withinOrb() && match.delta() < bestDelta) {
                bestType = type;
                bestDelta = match.delta();
            }
        }
        if (bestType == null) {
            return null;
        }

        double orb = orbTable.orbFor(bestType);
        AspectDirection direction = directionClassifier.classify(
            a.longitude(), a.speed(), b.longitude(), b.speed(), bestType.angle());

        return AspectRecord.of(
            a.body(), b.body(), bestType,
            AngleMath.angularDistance(a.longitude(), b.longitude()),
            bestDelta,
            true,
            bestDelta < exactEpsilon,
            Math.max(0.0, 1.0 - bestDelta / orb),
            direction);
    }

    public OrbTable orbTable() {
        return orbTable;
    }

    public double exactEpsilon() {
        return exactEpsilon;
    }
}
