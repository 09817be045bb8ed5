package com.mead.kpcdst.model;

public enum SampleType {
    SERUM("serum"),
    PLASMA("plasma");

    private final String label;

    SampleType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SampleType fromLabel(String label) {
        for (SampleType sampleType : values()) {
            if (sampleType.label.equalsIgnoreCase(label)) return sampleType;
        }
        throw new IllegalArgumentException("Unknown sample type: " + label);
    }
}
