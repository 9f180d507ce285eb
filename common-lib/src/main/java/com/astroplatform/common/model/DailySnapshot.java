package com.astroplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The engine's sole output: the complete astrological state for one instant.
 *
 * <p>Produced once per instant by {@link com.astroplatform.common.snapshot.SnapshotAssembler};
 * immutable afterwards. Lists are copied on construction.
 *
 * <ul>
 *   <li>{@code positions}: one per resolved body, in tracked order, no duplicates</li>
 *   <li>{@code failures}: bodies the provider could not resolve</li>
 *   <li>{@code aspects}: only relations within orb</li>
 *   <li>{@code lunarPhase}: {@code null} when the Sun or the Moon is missing</li>
 *   <li>{@code significantEvents}: ordered, unique</li>
 * </ul>
 */
public record DailySnapshot(
    @JsonProperty("instant")           Instant instant,
    @JsonProperty("status")            SnapshotStatus status,
    @JsonProperty("positions")         List<BodyPosition> positions,
    @JsonProperty("failures")          List<BodyFailure> failures,
    @JsonProperty("aspects")           List<AspectRecord> aspects,
    @JsonProperty("lunarPhase")        LunarPhase lunarPhase,
    @JsonProperty("significantEvents") List<String> significantEvents,
    @JsonProperty("dailyScore")        double dailyScore,
    @JsonProperty("marketOutlook")     MarketOutlook marketOutlook
) {
    public DailySnapshot {
        if (instant == null || status == null || marketOutlook == null) {
            throw new IllegalArgumentException("instant, status and marketOutlook are required");
        }
        positions         = positions == null ? List.of() : List.copyOf(positions);
        failures          = failures == null ? List.of() : List.copyOf(failures);
        aspects           = aspects == null ? List.of() : List.copyOf(aspects);
        significantEvents = significantEvents == null ? List.of() : List.copyOf(significantEvents);

        Set<CelestialBody> seen = EnumSet.noneOf(CelestialBody.class);
        for (BodyPosition p : positions) {
            if (!seen.add(p.body())) {
                throw new IllegalArgumentException("duplicate position for " + p.body());
            }
        }
        if (new HashSet<>(significantEvents).size() != significantEvents.size()) {
            throw new IllegalArgumentException("significant events must be unique: " + significantEvents);
        }
        for (AspectRecord a : aspects) {
            if (!a.withinOrb()) {
                throw new IllegalArgumentException("aspect outside orb: " + a.describe());
            }
        }
        if (!(dailyScore >= 0.0 && dailyScore <= 100.0)) {
            throw new IllegalArgumentException("dailyScore out of [0,100]: " + dailyScore);
        }
    }

    @JsonIgnore
    public boolean isPartial() {
        return status == SnapshotStatus.PARTIAL;
    }

    @JsonIgnore
    public boolean hasLunarPhase() {
        return lunarPhase != null;
    }

    /** Fewer than two usable bodies: no pair can form an aspect. */
    @JsonIgnore
    public boolean isInsufficientData() {
        return positions.size() < 2;
    }

    public Optional<BodyPosition> position(CelestialBody body) {
        return positions.stream().filter(p -> p.body() == body).findFirst();
    }
}
