package com.mead.kpcdst.model;

public enum KpRiskLevel {
    LOW("KP within normal range. Standard menopause management recommended."),
    LOW_MODERATE("Mild KP changes consistent with normal perimenopause transition."),
    MODERATE("Moderate KP activation. Monitor and consider targeted intervention if symptomatic."),
    HIGH("Significant KP dysregulation. Elevated neurotoxic shift. Consider intervention.");

    private final String interpretation;

    KpRiskLevel(String interpretation) {
        this.interpretation = interpretation;
    }

    public String interpretation() {
        return interpretation;
    }

    public boolean isElevated() {
        return this == HIGH || this == MODERATE;
    }
}
