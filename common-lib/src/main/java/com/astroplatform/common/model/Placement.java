package com.astroplatform.common.model;

/**
 * Which third of its sign a body occupies: early [0,10), middle [10,20), late [20,30).
 */
public enum Placement {
    EARLY,
    MIDDLE,
    LATE;

    public static Placement fromDegreeInSign(double degreeInSign) {
        if (degreeInSign < 10.0) return EARLY;
        if (degreeInSign < 20.0) return MIDDLE;
        return LATE;
    }
}
