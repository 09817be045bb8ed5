package com.mead.kpcdst.model;

import java.util.Objects;

public record NormativeReference(
        Metabolite metabolite,
        SampleType sampleType,
        NormPopulation population,
        double mean,
        double standardDeviation,
        String unit,
        String label
) {
    public NormativeReference {
        Objects.requireNonNull(metabolite, "metabolite");
        Objects.requireNonNull(sampleType, "sampleType");
        Objects.requireNonNull(population, "population");
        if (mean <= 0) {
            throw new IllegalArgumentException("Normative mean must be positive for " + describe(metabolite, sampleType, population) + ": " + mean);
        }
        if (standardDeviation < 0) {
            throw new IllegalArgumentException("Standard deviation must not be negative for " + describe(metabolite, sampleType, population) + ": " + standardDeviation);
        }
    }

    private static String describe(Metabolite metabolite, SampleType sampleType, NormPopulation population) {
        return population.label() + " " + sampleType.label() + " " + metabolite.name();
    }
}
