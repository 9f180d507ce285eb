package com.astroplatform.common.scoring;

import com.astroplatform.common.aspect.OrbTable;
import com.astroplatform.common.exception.EngineConfigurationException;
import com.astroplatform.common.model.AspectNature;
import com.astroplatform.common.model.AspectRecord;
import com.astroplatform.common.model.BodyPosition;
import com.astroplatform.common.model.LunarPhase;
import com.astroplatform.common.model.MarketOutlook;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregates the aspects and lunar phase of one instant into a score, an outlook and a
 * list of significant events.
 *
 * <h3>Score</h3>
 * <ol>
 *   <li>Start from {@code baseScore} (neutral, 50 by default).</li>
 *   <li>Each major aspect adds {@code polarity × weight × (1 − delta / orb)}: exact aspects
 *       contribute their full weight, aspects at the orb limit nothing. Trine, sextile and
 *       conjunction push up, square and opposition push down.</li>
 *   <li>A new or full moon adds {@code phaseVolatilityBonus} to the magnitude of that
 *       adjustment without changing its sign. With no adjustment the bonus is added upward,
 *       so a phase-only day still moves off the base.</li>
 *   <li>The adjustment is capped to {@code [−base, 100 − base]}; the score is rounded to
 *       one decimal.</li>
 * </ol>
 *
 * <h3>Outlook</h3>
 * <pre>
 *   score ≥ bullishThreshold  → BULLISH
 *   score ≤ bearishThreshold  → BEARISH
 *   volatile day              → VOLATILE
 *   otherwise                 → NEUTRAL
 * </pre>
 * A day is volatile on a new or full moon, or when hard aspects outnumber harmonious ones
 * by more than {@code hardAspectMargin}.
 *
 * <h3>Events</h3>
 * Exact or notable aspects in detector order, then the phase event ("New Moon",
 * "Full Moon"), then optional ingress and retrograde events. Duplicates are dropped.
 *
 * <p>Stateless and thread-safe. No logging.
 */
public final class SignificanceScorer {

    private static final double INGRESS_WINDOW = 1.0;
    private static final double EGRESS_START = 29.0;

    private final ScoringConfig config;
    private final OrbTable orbTable;

    public SignificanceScorer() {
        this(ScoringConfig.defaults(), OrbTable.defaults());
    }

    /**
     * @param orbTable must be the table the detector used, so that {@code delta / orb}
     *                 measures closeness against the same limit
     */
    public SignificanceScorer(ScoringConfig config, OrbTable orbTable) {
        if (config == null || orbTable == null) {
            throw new EngineConfigurationException("SignificanceScorer", "config and orbTable are required");
        }
        this.config = config;
        this.orbTable = orbTable;
    }

    /**
     * @param aspects    within-orb aspects in detector order
     * @param lunarPhase {@code null} when the Sun or the Moon is unavailable
     * @param positions  resolved positions, used only for ingress/retrograde events
     */
    public SignificanceResult score(List<AspectRecord> aspects, LunarPhase lunarPhase, List<BodyPosition> positions) {
        List<AspectRecord> safeAspects = aspects == null ? List.of() : aspects;
        List<BodyPosition> safePositions = positions == null ? List.of() : positions;

        double adjustment = aspectAdjustment(safeAspects);
        boolean phaseVolatile = lunarPhase != null && lunarPhase.phaseName().isVolatile();
        boolean volatileDay = phaseVolatile || hardAspectImbalance(safeAspects);

        double total = adjustment;
        if (phaseVolatile) {
            double direction = total < 0.0 ? -1.0 : 1.0;
            total += direction * config.phaseVolatilityBonus();
        }

        double base = config.baseScore();
        double capped = Math.max(-base, Math.min(100.0 - base, total));
        double dailyScore = clampScore(Math.round((base + capped) * 10.0) / 10.0);

        return new SignificanceResult(
            dailyScore,
            resolveOutlook(dailyScore, volatileDay),
            volatileDay,
            adjustment,
            significantEvents(safeAspects, lunarPhase, safePositions));
    }

    /**
     * Pure mapping from score and volatility to the outlook label. No hidden state.
     */
    public MarketOutlook resolveOutlook(double dailyScore, boolean volatileDay) {
        if (dailyScore >= config.bullishThreshold()) return MarketOutlook.BULLISH;
        if (dailyScore <= config.bearishThreshold()) return MarketOutlook.BEARISH;
        if (volatileDay) return MarketOutlook.VOLATILE;
        return MarketOutlook.NEUTRAL;
    }

    /** Signed sum of major-aspect contributions, before the phase bonus and the cap. */
    public double aspectAdjustment(List<AspectRecord> aspects) {
        double sum = 0.0;
        for (AspectRecord aspect : aspects) {
            if (!aspect.withinOrb() || !config.isMajor(aspect.aspectType())) {
                continue;
            }
            double orb = orbTable.orbFor(aspect.aspectType());
            double closeness = Math.max(0.0, 1.0 - aspect.orbDelta() / orb);
            sum += aspect.aspectType().polarity() * config.weight(aspect.aspectType()) * closeness;
        }
        return sum;
    }

    public List<String> significantEvents(List<AspectRecord> aspects, LunarPhase lunarPhase,
                                          List<BodyPosition> positions) {
        Set<String> events = new LinkedHashSet<>();

        for (AspectRecord aspect : aspects) {
            if (aspect.exact() || (aspect.withinOrb() && aspect.orbDelta() < config.notableOrb())) {
                events.add(aspect.describe());
            }
        }

        if (lunarPhase != null && lunarPhase.phaseName().isVolatile()) {
            events.add(lunarPhase.phaseName().displayName());
        }

        if (config.includeIngressEvents()) {
            for (BodyPosition p : positions) {
                if (p.degreeInSign() <= INGRESS_WINDOW) {
                    events.add(p.body().displayName() + " entering " + p.sign().displayName());
                } else if (p.degreeInSign() >= EGRESS_START) {
                    events.add(p.body().displayName() + " leaving " + p.sign().displayName());
                }
            }
        }
        if (config.includeRetrogradeEvents()) {
            for (BodyPosition p : positions) {
                if (p.isRetrograde()) {
                    events.add(p.body().displayName() + " retrograde");
                }
            }
        }
        return new ArrayList<>(events);
    }

    public ScoringConfig config() {
        return config;
    }

    public OrbTable orbTable() {
        return orbTable;
    }

    private boolean hardAspectImbalance(List<AspectRecord> aspects) {
        int hard = 0;
        int harmonious = 0;
        for (AspectRecord aspect : aspects) {
            AspectNature nature = aspect.aspectType().nature();
            if (nature == AspectNature.HARD) hard++;
            else if (nature == AspectNature.HARMONIOUS) harmonious++;
        }
        return hard > harmonious + config.hardAspectMargin();
    }

    private static double clampScore(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }
}
