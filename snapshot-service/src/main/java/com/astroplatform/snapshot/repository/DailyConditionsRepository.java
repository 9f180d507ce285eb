package com.astroplatform.snapshot.repository;

import com.astroplatform.snapshot.model.DailyConditions;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;

@Repository
public interface DailyConditionsRepository extends ReactiveCrudRepository<DailyConditions, Long> {

    Mono<DailyConditions> findByTradeDate(LocalDate tradeDate);

    Flux<DailyConditions> findByTradeDateBetweenOrderByTradeDateAsc(LocalDate from, LocalDate to);

    /**
     * Atomic UPSERT: recomputing a date replaces its row.
     */
    @Modifying
    @Query("""
        INSERT INTO daily_astrological_conditions
            (trade_date, snapshot_instant, status, planetary_positions, major_aspects, body_failures,
             lunar_phase_name, lunar_phase_angle, lunar_illumination, significant_events,
             daily_score, market_outlook, created_at)
        VALUES
            (:tradeDate, :snapshotInstant, :status, CAST(:positions AS JSONB), CAST(:aspects AS JSONB),
             CAST(:failures AS JSONB), :phaseName, :phaseAngle, :illumination, CAST(:events AS JSONB),
             :dailyScore, :marketOutlook, NOW())
        ON CONFLICT (trade_date) DO UPDATE SET
            snapshot_instant    = :snapshotInstant,
            status              = :status,
            planetary_positions = CAST(:positions AS JSONB),
            major_aspects       = CAST(:aspects AS JSONB),
            body_failures       = CAST(:failures AS JSONB),
            lunar_phase_name    = :phaseName,
            lunar_phase_angle   = :phaseAngle,
            lunar_illumination  = :illumination,
            significant_events  = CAST(:events AS JSONB),
            daily_score         = :dailyScore,
            market_outlook      = :marketOutlook,
            created_at          = NOW()
        """)
    Mono<Integer> upsert(LocalDate tradeDate, Instant snapshotInstant, String status,
                         String positions, String aspects, String failures,
                         String phaseName, Double phaseAngle, Double illumination, String events,
                         double dailyScore, String marketOutlook);
}
