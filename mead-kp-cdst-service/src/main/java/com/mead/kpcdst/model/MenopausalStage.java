package com.mead.kpcdst.model;

public enum MenopausalStage {
    EARLY_PERIMENOPAUSE("Early perimenopause"),
    LATE_PERIMENOPAUSE("Late perimenopause"),
    EARLY_POSTMENOPAUSE("Early postmenopause (<5yr)"),
    LATE_POSTMENOPAUSE("Late postmenopause (>5yr)"),
    SURGICAL_MENOPAUSE("Surgical menopause");

    private final String label;

    MenopausalStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static MenopausalStage fromLabel(String label) {
        for (MenopausalStage stage : values()) {
            if (stage.label.equalsIgnoreCase(label)) return stage;
        }
        throw new IllegalArgumentException("Unknown menopausal stage: " + label);
    }
}
