package com.astroplatform.common.scoring;

import com.astroplatform.common.model.MarketOutlook;

import java.util.List;

/**
 * Output of {@link SignificanceScorer} for one instant.
 *
 * @param aspectAdjustment signed sum of major-aspect contributions before the phase bonus and cap
 * @param volatileDay      set by a new/full moon or by a hard-aspect imbalance
 */
public record SignificanceResult(
    double dailyScore,
    MarketOutlook marketOutlook,
    boolean volatileDay,
    double aspectAdjustment,
    List<String> significantEvents
) {
    public SignificanceResult {
        significantEvents = significantEvents == null ? List.of() : List.copyOf(significantEvents);
    }
}
