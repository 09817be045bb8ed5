package com.mead.kpcdst.model;

public enum ApoeStatus {
    UNKNOWN("Unknown"),
    NON_CARRIER("Non-carrier"),
    HETEROZYGOUS("Heterozygous (e3/e4)"),
    HOMOZYGOUS("Homozygous (e4/e4)");

    private final String label;

    ApoeStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ApoeStatus fromLabel(String label) {
        for (ApoeStatus status : values()) {
            if (status.label.equalsIgnoreCase(label)) return status;
        }
        throw new IllegalArgumentException("Unknown APOE status: " + label);
    }
}
