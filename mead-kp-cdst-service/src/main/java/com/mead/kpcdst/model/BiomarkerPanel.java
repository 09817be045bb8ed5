package com.mead.kpcdst.model;

import java.util.Objects;

/**
 * Measured TRP and KYN concentrations (μM) and the normative table to score them against.
 */
public record BiomarkerPanel(
        SampleType sampleType,
        NormPopulation population,
        double trp,
        double kyn
) {
    public BiomarkerPanel {
        Objects.requireNonNull(sampleType, "sampleType");
        if (population == null) population = NormPopulation.REGIONAL;
        requireConcentration("TRP", trp);
        requireConcentration("KYN", kyn);
    }

    public static BiomarkerPanel of(SampleType sampleType, double trp, double kyn) {
        return new BiomarkerPanel(sampleType, NormPopulation.REGIONAL, trp, kyn);
    }

    private static void requireConcentration(String metabolite, double value) {
        // Rejects NaN as well as negative and infinite values.
        if (!(value >= 0) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(metabolite + " must be a finite, non-negative concentration: " + value);
        }
    }
}
