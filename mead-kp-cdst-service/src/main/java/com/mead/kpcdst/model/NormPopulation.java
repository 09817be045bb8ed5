package com.mead.kpcdst.model;

/**
 * Which normative table a biomarker panel is scored against.
 * {@code REGIONAL} is the Australian subset of the pooled data.
 */
public enum NormPopulation {
    GLOBAL("global"),
    REGIONAL("regional");

    private final String label;

    NormPopulation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static NormPopulation fromLabel(String label) {
        for (NormPopulation population : values()) {
            if (population.label.equalsIgnoreCase(label)) return population;
        }
        throw new IllegalArgumentException("Unknown normative population: " + label);
    }
}
