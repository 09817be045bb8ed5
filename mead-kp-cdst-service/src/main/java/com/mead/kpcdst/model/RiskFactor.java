package com.mead.kpcdst.model;

public enum RiskFactor {
    EARLY_MENOPAUSE("Early/surgical menopause (<45)"),
    FAMILY_HISTORY_DEMENTIA("Family history of dementia"),
    BILATERAL_OOPHORECTOMY("Bilateral oophorectomy"),
    NO_CURRENT_MHT("No current MHT use"),
    HISTORY_OF_DEPRESSION("History of depression");

    private final String label;

    RiskFactor(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static RiskFactor fromLabel(String label) {
        for (RiskFactor factor : values()) {
            if (factor.label.equalsIgnoreCase(label)) return factor;
        }
        throw new IllegalArgumentException("Unknown risk factor: " + label);
    }
}
