package com.mead.kpcdst.model;

/**
 * A regression slope (beta) with its p-value, per metabolite and sample type.
 * Used for both the age and the sex effect tables.
 */
public record RegressionCoefficient(
        Metabolite metabolite,
        SampleType sampleType,
        double beta,
        double pValue
) {}
