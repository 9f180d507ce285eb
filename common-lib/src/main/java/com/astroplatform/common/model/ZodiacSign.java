package com.astroplatform.common.model;

import com.astroplatform.common.angle.AngleMath;

public enum ZodiacSign {
    ARIES("Aries"),
    TAURUS("Taurus"),
    GEMINI("Gemini"),
    CANCER("Cancer"),
    LEO("Leo"),
    VIRGO("Virgo"),
    LIBRA("Libra"),
    SCORPIO("Scorpio"),
    SAGITTARIUS("Sagittarius"),
    CAPRICORN("Capricorn"),
    AQUARIUS("Aquarius"),
    PISCES("Pisces");

    /** Width of one sign in ecliptic degrees. */
    public static final double SIGN_WIDTH = 30.0;

    private static final ZodiacSign[] BY_INDEX = values();

    private final String displayName;

    ZodiacSign(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** Sign containing the given ecliptic longitude: {@code floor(normalize(lon) / 30)}. */
    public static ZodiacSign fromLongitude(double longitude) {
        int index = (int) Math.floor(AngleMath.normalize(longitude) / SIGN_WIDTH);
        return BY_INDEX[Math.min(index, BY_INDEX.length - 1)];
    }
}
