package com.astroplatform.snapshot.dto;

import com.astroplatform.common.model.DailySnapshot;
import com.astroplatform.common.model.MarketOutlook;
import com.astroplatform.common.model.SnapshotStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Compact per-date line of a batch result.
 */
public record SnapshotSummaryDTO(
    @JsonProperty("tradeDate")         LocalDate tradeDate,
    @JsonProperty("status")            SnapshotStatus status,
    @JsonProperty("dailyScore")        double dailyScore,
    @JsonProperty("marketOutlook")     MarketOutlook marketOutlook,
    @JsonProperty("lunarPhase")        String lunarPhase,        // null without Sun or Moon
    @JsonProperty("significantEvents") List<String> significantEvents
) {
    public static SnapshotSummaryDTO of(LocalDate tradeDate, DailySnapshot snapshot) {
        return new SnapshotSummaryDTO(
            tradeDate,
            snapshot.status(),
            snapshot.dailyScore(),
            snapshot.marketOutlook(),
            snapshot.lunarPhase() != null ? snapshot.lunarPhase().phaseName().code() : null,
            snapshot.significantEvents());
    }
}
