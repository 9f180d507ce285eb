package com.astroplatform.snapshot.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One stored daily snapshot, keyed by trade date.
 *
 * planetaryPositions: JSON-serialised {@code List<BodyPosition>}
 * majorAspects      : JSON-serialised {@code List<AspectRecord>}
 * bodyFailures      : JSON-serialised {@code List<BodyFailure>}
 * significantEvents : JSON array, order preserved
 *
 * Lunar columns are null when the Sun or the Moon could not be resolved.
 */
@Data
@NoArgsConstructor
@Table("daily_astrological_conditions")
public class DailyConditions {

    @Id
    private Long id;

    private LocalDate tradeDate;

    private Instant snapshotInstant;

    private String status;

    private String planetaryPositions;

    private String majorAspects;

    private String bodyFailures;

    private String lunarPhaseName;

    private Double lunarPhaseAngle;

    private Double lunarIllumination;

    private String significantEvents;

    private double dailyScore;

    private String marketOutlook;

    private LocalDateTime createdAt;
}
