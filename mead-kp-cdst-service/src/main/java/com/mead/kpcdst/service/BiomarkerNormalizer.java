package com.mead.kpcdst.service;

/**
 * Age adjustment and z-scoring against normative KP reference values.
 */
public final class BiomarkerNormalizer {

    /** Mean age of the normative cohort; age regressions are centred here. */
    public static final double REFERENCE_AGE = 47.35;

    private BiomarkerNormalizer() {}

    public static double ageAdjust(double age, double baseMean, double slope) {
        return baseMean + slope * (age - REFERENCE_AGE);
    }

    /**
     * Standardized deviation of {@code value} from {@code mean}. Zero when {@code sd} is zero.
     */
    public static double zScore(double value, double mean, double sd) {
        if (sd == 0) return 0;
        return (value - mean) / sd;
    }
}
