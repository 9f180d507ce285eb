package com.astroplatform.snapshot.service;

import com.astroplatform.common.ephemeris.EphemerisProvider;
import com.astroplatform.common.ephemeris.EphemerisProviderFactory;
import com.astroplatform.common.ephemeris.EphemerisReading;
import com.astroplatform.common.exception.BodyUnavailableException;
import com.astroplatform.common.exception.InvalidInstantException;
import com.astroplatform.common.model.BodyFailure;
import com.astroplatform.common.model.CelestialBody;
import com.astroplatform.common.model.DailySnapshot;
import com.astroplatform.common.snapshot.SnapshotAssembler;
import com.astroplatform.snapshot.model.DailyConditions;
import com.astroplatform.snapshot.persistence.DailyConditionsMapper;
import com.astroplatform.snapshot.repository.DailyConditionsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reactive front of the engine: computes, stores and reads daily snapshots.
 *
 * <p><strong>Compute flow:</strong>
 * <ol>
 *   <li>Open a provider from the {@link EphemerisProviderFactory}. Providers are not
 *       thread-safe, so every compute gets its own.</li>
 *   <li>Reject instants the provider does not support ({@link InvalidInstantException}).</li>
 *   <li>Fetch each tracked body on {@code boundedElastic}, one after another, each bounded by
 *       {@code astro.ephemeris.body-timeout}. A timeout or provider error becomes a
 *       {@link BodyFailure}; the other bodies continue. A timed-out call keeps running on
 *       its thread, so the remaining bodies are fetched from a freshly opened provider.</li>
 *   <li>Hand readings and failures to {@link SnapshotAssembler}.</li>
 * </ol>
 *
 * <p>A trade date is computed at 12:00 UTC.
 */
@Service
public class SnapshotService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

    private static final LocalTime SNAPSHOT_TIME = LocalTime.NOON;

    private final SnapshotAssembler assembler;
    private final EphemerisProviderFactory providerFactory;
    private final DailyConditionsRepository repository;
    private final DailyConditionsMapper mapper;
    private final Duration bodyTimeout;

    public SnapshotService(SnapshotAssembler assembler,
                           EphemerisProviderFactory providerFactory,
                           DailyConditionsRepository repository,
                           DailyConditionsMapper mapper,
                           @Value("${astro.ephemeris.body-timeout:2s}") Duration bodyTimeout) {
        this.assembler   = assembler;
        this.providerFactory = providerFactory;
        this.repository  = repository;
        this.mapper      = mapper;
        this.bodyTimeout = bodyTimeout;
    }

    public static Instant snapshotInstant(LocalDate tradeDate) {
        return tradeDate.atTime(SNAPSHOT_TIME).toInstant(ZoneOffset.UTC);
    }

    /** Computes without storing. */
    public Mono<DailySnapshot> compute(LocalDate tradeDate) {
        if (tradeDate == null) {
            return Mono.error(new InvalidInstantException("trade date is required"));
        }
        return computeAt(snapshotInstant(tradeDate));
    }

    public Mono<DailySnapshot> computeAt(Instant instant) {
        return Mono.defer(() -> {
            if (instant == null) {
                return Mono.error(new InvalidInstantException("instant is required"));
            }
            AtomicReference<EphemerisProvider> handle = new AtomicReference<>(providerFactory.open());
            if (!handle.get().supports(instant)) {
                return Mono.error(new InvalidInstantException(
                    "instant " + instant + " is outside the provider's supported range"));
            }
            return Flux.fromIterable(assembler.trackedBodies())
                .concatMap(body -> fetch(instant, body, handle))
                .collectList()
                .map(fetches -> assemble(instant, fetches, handle.get()));
        });
    }

    /** Computes, upserts and returns the snapshot for {@code tradeDate}. */
    public Mono<DailySnapshot> computeAndStore(LocalDate tradeDate) {
        return compute(tradeDate)
            .flatMap(snapshot -> store(tradeDate, snapshot).thenReturn(snapshot))
            .doOnSuccess(s -> log.info("SNAPSHOT_COMPUTED date={} status={} score={} outlook={} events={}",
                                       tradeDate, s.status(), s.dailyScore(), s.marketOutlook(),
                                       s.significantEvents().size()))
            .doOnError(e -> log.error("Snapshot compute failed. date={}", tradeDate, e));
    }

    public Mono<Void> store(LocalDate tradeDate, DailySnapshot snapshot) {
        return Mono.fromCallable(() -> mapper.toEntity(tradeDate, snapshot))
            .flatMap(this::upsert)
            .doOnSuccess(v -> log.debug("SNAPSHOT_STORED date={} status={}", tradeDate, snapshot.status()))
            .then();
    }

    public Mono<DailySnapshot> findByDate(LocalDate tradeDate) {
        return repository.findByTradeDate(tradeDate)
            .map(mapper::toSnapshot);
    }

    /** Stored snapshots in {@code [from, to]}, in date order. */
    public Flux<DailySnapshot> findRange(LocalDate from, LocalDate to) {
        if (from == null || to == null || from.isAfter(to)) {
            return Flux.error(new InvalidInstantException("invalid date range " + from + " .. " + to));
        }
        return repository.findByTradeDateBetweenOrderByTradeDateAsc(from, to)
            .map(mapper::toSnapshot);
    }

    private Mono<Integer> upsert(DailyConditions e) {
        return repository.upsert(
            e.getTradeDate(), e.getSnapshotInstant(), e.getStatus(),
            e.getPlanetaryPositions(), e.getMajorAspects(), e.getBodyFailures(),
            e.getLunarPhaseName(), e.getLunarPhaseAngle(), e.getLunarIllumination(),
            e.getSignificantEvents(), e.getDailyScore(), e.getMarketOutlook());
    }

    private Mono<BodyFetch> fetch(Instant instant, CelestialBody body, AtomicReference<EphemerisProvider> handle) {
        return Mono.defer(() -> {
            EphemerisProvider provider = handle.get();
            return Mono.fromCallable(() -> provider.position(instant, body))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(bodyTimeout)
                .map(reading -> new BodyFetch(body, reading, null))
                .onErrorResume(e -> {
                    if (e instanceof TimeoutException) {
                        handle.set(providerFactory.open());
                        log.warn("PROVIDER_REPLACED instant={} body={} reason=timeout after {}ms",
                                 instant, body, bodyTimeout.toMillis());
                    }
                    return Mono.just(new BodyFetch(body, null, new BodyFailure(body, reason(e))));
                });
        });
    }

    private DailySnapshot assemble(Instant instant, List<BodyFetch> fetches, EphemerisProvider provider) {
        Map<CelestialBody, EphemerisReading> readings = new EnumMap<>(CelestialBody.class);
        List<BodyFailure> failures = new ArrayList<>();
        for (BodyFetch f : fetches) {
            if (f.reading() != null) {
                readings.put(f.body(), f.reading());
            } else {
                failures.add(f.failure());
            }
        }
        return assembler.withProvider(provider).assemble(instant, readings, failures);
    }

    private String reason(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timed out after " + bodyTimeout.toMillis() + "ms";
        }
        if (e instanceof BodyUnavailableException) {
            return e.getMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private record BodyFetch(CelestialBody body, EphemerisReading reading, BodyFailure failure) {}
}
