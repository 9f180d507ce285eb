package com.astroplatform.snapshot.config;

import com.astroplatform.common.aspect.AspectDetector;
import com.astroplatform.common.aspect.OrbTable;
import com.astroplatform.common.direction.DirectionClassifier;
import com.astroplatform.common.ephemeris.EphemerisProviderFactory;
import com.astroplatform.common.exception.EngineConfigurationException;
import com.astroplatform.common.model.AspectType;
import com.astroplatform.common.model.CelestialBody;
import com.astroplatform.common.scoring.ScoringConfig;
import com.astroplatform.common.scoring.SignificanceScorer;
import com.astroplatform.common.snapshot.SnapshotAssembler;
import com.astroplatform.snapshot.provider.KeplerianEphemerisProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wires the engine from {@code astro.engine.*}. Invalid values fail start-up with
 * {@link EngineConfigurationException}.
 */
@Configuration
public class SnapshotConfig {

    private static final Logger log = LoggerFactory.getLogger(SnapshotConfig.class);

    @Value("${astro.engine.orbs.conjunction:8.0}")
    private double conjunctionOrb;

    @Value("${astro.engine.orbs.sextile:6.0}")
    private double sextileOrb;

    @Value("${astro.engine.orbs.square:8.0}")
    private double squareOrb;

    @Value("${astro.engine.orbs.trine:8.0}")
    private double trineOrb;

    @Value("${astro.engine.orbs.opposition:8.0}")
    private double oppositionOrb;

    @Value("${astro.engine.exact-epsilon:0.1}")
    private double exactEpsilon;

    @Value("${astro.engine.stationary-epsilon:0.01}")
    private double stationaryEpsilon;

    @Value("${astro.engine.tracked-bodies:SUN,MOON,MERCURY,VENUS,MARS,JUPITER,SATURN,URANUS,NEPTUNE,PLUTO}")
    private String trackedBodiesConfig;

    @Value("${astro.engine.scoring.base-score:50.0}")
    private double baseScore;

    @Value("${astro.engine.scoring.major-aspects:CONJUNCTION,OPPOSITION,SQUARE}")
    private String majorAspectsConfig;

    @Value("${astro.engine.scoring.weights.conjunction:6.0}")
    private double conjunctionWeight;

    @Value("${astro.engine.scoring.weights.sextile:4.0}")
    private double sextileWeight;

    @Value("${astro.engine.scoring.weights.square:8.0}")
    private double squareWeight;

    @Value("${astro.engine.scoring.weights.trine:6.0}")
    private double trineWeight;

    @Value("${astro.engine.scoring.weights.opposition:8.0}")
    private double oppositionWeight;

    @Value("${astro.engine.scoring.phase-volatility-bonus:5.0}")
    private double phaseVolatilityBonus;

    @Value("${astro.engine.scoring.bullish-threshold:70.0}")
    private double bullishThreshold;

    @Value("${astro.engine.scoring.bearish-threshold:30.0}")
    private double bearishThreshold;

    @Value("${astro.engine.scoring.notable-orb:1.0}")
    private double notableOrb;

    @Value("${astro.engine.scoring.hard-aspect-margin:2}")
    private int hardAspectMargin;

    @Value("${astro.engine.events.ingress:false}")
    private boolean includeIngressEvents;

    @Value("${astro.engine.events.retrograde:false}")
    private boolean includeRetrogradeEvents;

    @Bean
    public OrbTable orbTable() {
        Map<AspectType, Double> orbs = new EnumMap<>(AspectType.class);
        orbs.put(AspectType.CONJUNCTION, conjunctionOrb);
        orbs.put(AspectType.SEXTILE, sextileOrb);
        orbs.put(AspectType.SQUARE, squareOrb);
        orbs.put(AspectType.TRINE, trineOrb);
        orbs.put(AspectType.OPPOSITION, oppositionOrb);
        return OrbTable.of(orbs);
    }

    @Bean
    public AspectDetector aspectDetector(OrbTable orbTable) {
        return new AspectDetector(orbTable, exactEpsilon, new DirectionClassifier(stationaryEpsilon));
    }

    @Bean
    public ScoringConfig scoringConfig() {
        return ScoringConfig.builder()
            .baseScore(baseScore)
            .majorAspects(parseEnumSet(AspectType.class, majorAspectsConfig))
            .weight(AspectType.CONJUNCTION, conjunctionWeight)
            .weight(AspectType.SEXTILE, sextileWeight)
            .weight(AspectType.SQUARE, squareWeight)
            .weight(AspectType.TRINE, trineWeight)
            .weight(AspectType.OPPOSITION, oppositionWeight)
            .phaseVolatilityBonus(phaseVolatilityBonus)
            .bullishThreshold(bullishThreshold)
            .bearishThreshold(bearishThreshold)
            .notableOrb(notableOrb)
            .hardAspectMargin(hardAspectMargin)
            .includeIngressEvents(includeIngressEvents)
            .includeRetrogradeEvents(includeRetrogradeEvents)
            .build();
    }

    @Bean
    public SignificanceScorer significanceScorer(ScoringConfig scoringConfig, OrbTable orbTable) {
        return new SignificanceScorer(scoringConfig, orbTable);
    }

    @Bean
    public EphemerisProviderFactory ephemerisProviderFactory() {
        return KeplerianEphemerisProvider::new;
    }

    @Bean
    public SnapshotAssembler snapshotAssembler(EphemerisProviderFactory ephemerisProviderFactory,
                                               AspectDetector aspectDetector,
                                               SignificanceScorer significanceScorer) {
        List<CelestialBody> tracked = parseBodies(trackedBodiesConfig);
        log.info("Snapshot engine configured. trackedBodies={} orbs={} exactEpsilon={}",
                 tracked, aspectDetector.orbTable(), aspectDetector.exactEpsilon());
        return new SnapshotAssembler(ephemerisProviderFactory.open(), aspectDetector, significanceScorer, tracked);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    static List<CelestialBody> parseBodies(String config) {
        List<CelestialBody> bodies = new ArrayList<>();
        for (String raw : config.split(",")) {
            String name = raw.trim();
            if (name.isEmpty()) continue;
            try {
                bodies.add(CelestialBody.valueOf(name.toUpperCase()));
            } catch (IllegalArgumentException e) {
                throw new EngineConfigurationException("SnapshotConfig", "unknown celestial body: " + name);
            }
        }
        return bodies;
    }

    static <E extends Enum<E>> Set<E> parseEnumSet(Class<E> type, String config) {
        Set<E> values = EnumSet.noneOf(type);
        for (String raw : config.split(",")) {
            String name = raw.trim();
            if (name.isEmpty()) continue;
            try {
                values.add(Enum.valueOf(type, name.toUpperCase()));
            } catch (IllegalArgumentException e) {
                throw new EngineConfigurationException("SnapshotConfig",
                    "unknown " + type.getSimpleName() + ": " + name);
            }
        }
        return values;
    }
}
