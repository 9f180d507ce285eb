package com.astroplatform.common.aspect;

import com.astroplatform.common.exception.EngineConfigurationException;
import com.astroplatform.common.model.AspectType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Allowed orb, in degrees, for each canonical aspect type.
 *
 * <p>Every type must have an orb in {@code (0, 90)}. Immutable; the {@code with*} methods
 * return a new table.
 */
public final class OrbTable {

    private static final double MAX_ORB = 90.0;

    private final Map<AspectType, Double> orbs;

    private OrbTable(Map<AspectType, Double> orbs) {
        EnumMap<AspectType, Double> copy = new EnumMap<>(AspectType.class);
        for (AspectType type : AspectType.values()) {
            Double orb = orbs.get(type);
            if (orb == null) {
                throw new EngineConfigurationException("OrbTable", "missing orb for " + type.label());
            }
            if (!(orb > 0.0 && orb < MAX_ORB)) {
                throw new EngineConfigurationException("OrbTable",
                    "orb for " + type.label() + " must be in (0, " + MAX_ORB + "), got " + orb);
            }
            copy.put(type, orb);
        }
        this.orbs = Collections.unmodifiableMap(copy);
    }

    /** Conjunction 8°, sextile 6°, square 8°, trine 8°, opposition 8°. */
    public static OrbTable defaults() {
        Map<AspectType, Double> m = new EnumMap<>(AspectType.class);
        for (AspectType type : AspectType.values()) {
            m.put(type, type.defaultOrb());
        }
        return new OrbTable(m);
    }

    /** The same orb for every aspect type. */
    public static OrbTable uniform(double orb) {
        Map<AspectType, Double> m = new EnumMap<>(AspectType.class);
        for (AspectType type : AspectType.values()) {
            m.put(type, orb);
        }
        return new OrbTable(m);
    }

    public static OrbTable of(Map<AspectType, Double> orbs) {
        return new OrbTable(orbs);
    }

    public OrbTable withOrb(AspectType type, double orb) {
        Map<AspectType, Double> m = new EnumMap<>(orbs);
        m.put(type, orb);
        return new OrbTable(m);
    }

    public double orbFor(AspectType type) {
        return orbs.get(type);
    }

    public Map<AspectType, Double> asMap() {
        return orbs;
    }

    @Override
    public String toString() {
        return "OrbTable" + orbs;
    }
}
