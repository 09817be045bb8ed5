package com.mead.kpcdst.model;

/**
 * Treatment options in reference table order. Ranking ties keep this order.
 */
public enum Treatment {
    ITBS("iTBS"),
    MHT("MHT (HRT)"),
    SSRI_SNRI("SSRI/SNRI"),
    CBT("CBT (Better Access)"),
    MONITORING("Monitoring Only");

    private final String label;

    Treatment(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Treatment fromLabel(String label) {
        for (Treatment treatment : values()) {
            if (treatment.label.equalsIgnoreCase(label)) return treatment;
        }
        throw new IllegalArgumentException("Unknown treatment: " + label);
    }
}
