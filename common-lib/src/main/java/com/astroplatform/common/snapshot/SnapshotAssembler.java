package com.astroplatform.common.snapshot;

import com.astroplatform.common.aspect.AspectDetector;
import com.astroplatform.common.ephemeris.EphemerisProvider;
import com.astroplatform.common.ephemeris.EphemerisReading;
import com.astroplatform.common.exception.BodyUnavailableException;
import com.astroplatform.common.exception.EngineConfigurationException;
import com.astroplatform.common.exception.InvalidInstantException;
import com.astroplatform.common.lunar.LunarPhaseClassifier;
import com.astroplatform.common.model.AspectRecord;
import com.astroplatform.common.model.BodyFailure;
import com.astroplatform.common.model.BodyPosition;
import com.astroplatform.common.model.CelestialBody;
import com.astroplatform.common.model.DailySnapshot;
import com.astroplatform.common.model.LunarPhase;
import com.astroplatform.common.model.SnapshotStatus;
import com.astroplatform.common.scoring.SignificanceResult;
import com.astroplatform.common.scoring.SignificanceScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the {@link DailySnapshot} for one instant.
 *
 * <p><strong>Pipeline:</strong>
 * <pre>
 *   instant → validate → one provider call per tracked body → AspectDetector (+ direction)
 *           → LunarPhaseClassifier → SignificanceScorer → DailySnapshot
 * </pre>
 *
 * <p><strong>Failure policy:</strong>
 * <ul>
 *   <li>A null instant, or one the provider does not support, fails with
 *       {@link InvalidInstantException}. No snapshot is produced.</li>
 *   <li>A body the provider cannot resolve is recorded as a {@link BodyFailure}, excluded from
 *       positions and aspects, and the snapshot is marked {@link SnapshotStatus#PARTIAL}.</li>
 *   <li>Without the Sun or the Moon there is no lunar phase and no phase contribution.</li>
 *   <li>Fewer than two bodies leaves the aspect list empty and the score at its neutral base.</li>
 * </ul>
 *
 * <p>Holds no mutable state and reads no clock: the same instant against the same
 * deterministic provider always yields an equal snapshot.
 */
public final class SnapshotAssembler {

    private static final Logger log = LoggerFactory.getLogger(SnapshotAssembler.class);

    private final EphemerisProvider provider;
    private final AspectDetector detector;
    private final SignificanceScorer scorer;
    private final List<CelestialBody> trackedBodies;

    public SnapshotAssembler(EphemerisProvider provider) {
        this(provider, new AspectDetector(), new SignificanceScorer(), List.of(CelestialBody.values()));
    }

    public SnapshotAssembler(EphemerisProvider provider,
                             AspectDetector detector,
                             SignificanceScorer scorer,
                             List<CelestialBody> trackedBodies) {
        if (provider == null || detector == null || scorer == null) {
            throw new EngineConfigurationException("SnapshotAssembler", "provider, detector and scorer are required");
        }
        if (!detector.orbTable().asMap().equals(scorer.orbTable().asMap())) {
            throw new EngineConfigurationException("SnapshotAssembler",
                "detector and scorer must share one orb table, got " + detector.orbTable() + " and " + scorer.orbTable());
        }
        if (trackedBodies == null || trackedBodies.isEmpty()) {
            throw new EngineConfigurationException("SnapshotAssembler", "at least one tracked body is required");
        }
        Set<CelestialBody> unique = EnumSet.noneOf(CelestialBody.class);
        for (CelestialBody body : trackedBodies) {
            if (body == null || !unique.add(body)) {
                throw new EngineConfigurationException("SnapshotAssembler", "duplicate or null tracked body: " + body);
            }
        }
        this.provider = provider;
        this.detector = detector;
        this.scorer = scorer;
        this.trackedBodies = List.copyOf(trackedBodies);
    }

    /** A copy wired to a different provider, used to give each compute or batch worker its own handle. */
    public SnapshotAssembler withProvider(EphemerisProvider otherProvider) {
        return new SnapshotAssembler(otherProvider, detector, scorer, trackedBodies);
    }

    /**
     * Fetches every tracked body from the provider, in tracked order, and assembles the snapshot.
     *
     * @throws InvalidInstantException when {@code instant} is null or unsupported
     */
    public DailySnapshot assemble(Instant instant) {
        validate(instant);

        Map<CelestialBody, EphemerisReading> readings = new EnumMap<>(CelestialBody.class);
        List<BodyFailure> failures = new ArrayList<>();

        for (CelestialBody body : trackedBodies) {
            try {
                readings.put(body, provider.position(instant, body));
            } catch (BodyUnavailableException e) {
                failures.add(new BodyFailure(body, e.getMessage()));
            } catch (RuntimeException e) {
                failures.add(new BodyFailure(body, e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }
        return assemble(instant, readings, failures);
    }

    /**
     * Assembles from readings obtained elsewhere (e.g. fetched with per-body timeouts).
     *
     * <p>Tracked bodies missing from {@code readings} without a matching failure are recorded
     * as failed; readings for untracked bodies are ignored.
     *
     * @throws InvalidInstantException when {@code instant} is null or unsupported
     */
    public DailySnapshot assemble(Instant instant,
                                  Map<CelestialBody, EphemerisReading> readings,
                                  List<BodyFailure> fetchFailures) {
        validate(instant);

        Map<CelestialBody, BodyFailure> failed = new EnumMap<>(CelestialBody.class);
        if (fetchFailures != null) {
            for (BodyFailure f : fetchFailures) {
                failed.putIfAbsent(f.body(), f);
            }
        }

        List<BodyPosition> positions = new ArrayList<>();
        for (CelestialBody body : trackedBodies) {
            if (failed.containsKey(body)) {
                continue;
            }
            EphemerisReading reading = readings == null ? null : readings.get(body);
            if (reading == null) {
                failed.put(body, new BodyFailure(body, "no reading"));
            } else if (!Double.isFinite(reading.longitude()) || !Double.isFinite(reading.speed())) {
                failed.put(body, new BodyFailure(body, "non-finite reading " + reading));
            } else {
                positions.add(BodyPosition.of(body, reading.longitude(), reading.speed()));
            }
        }

        List<BodyFailure> failures = new ArrayList<>();
        for (CelestialBody body : trackedBodies) {
            BodyFailure f = failed.get(body);
            if (f != null) {
                failures.add(f);
                log.warn("BODY_UNAVAILABLE instant={} body={} reason={}", instant, body, f.reason());
            }
        }

        List<AspectRecord> aspects = detector.detect(positions);
        LunarPhase lunarPhase = lunarPhase(positions);
        SignificanceResult significance = scorer.score(aspects, lunarPhase, positions);
        SnapshotStatus status = failures.isEmpty() ? SnapshotStatus.COMPLETE : SnapshotStatus.PARTIAL;

        log.debug("SNAPSHOT_ASSEMBLED instant={} status={} positions={} aspects={} score={} outlook={}",
                  instant, status, positions.size(), aspects.size(),
                  significance.dailyScore(), significance.marketOutlook());

        return new DailySnapshot(
            instant,
            status,
            positions,
            failures,
            aspects,
            lunarPhase,
            significance.significantEvents(),
            significance.dailyScore(),
            significance.marketOutlook());
    }

    public List<CelestialBody> trackedBodies() {
        return trackedBodies;
    }

    private void validate(Instant instant) {
        if (instant == null) {
            throw new InvalidInstantException("instant is required");
        }
        if (!provider.supports(instant)) {
            throw new InvalidInstantException("instant " + instant + " is outside the provider's supported range");
        }
    }

    private static LunarPhase lunarPhase(List<BodyPosition> positions) {
        BodyPosition sun = null;
        BodyPosition moon = null;
        for (BodyPosition p : positions) {
            if (p.body() == CelestialBody.SUN) sun = p;
            else if (p.body() == CelestialBody.MOON) moon = p;
        }
        if (sun == null || moon == null) {
            return null;
        }
        return LunarPhaseClassifier.compute(sun.longitude(), moon.longitude());
    }
}
