package com.mead.kpcdst.model;

public enum Symptom {
    COGNITIVE_FOG("Cognitive fog"),
    MEMORY_PROBLEMS("Memory problems"),
    DEPRESSION("Depression"),
    ANXIETY("Anxiety"),
    VASOMOTOR("Hot flushes/VMS"),
    SLEEP_DISTURBANCE("Sleep disturbance"),
    FATIGUE("Fatigue"),
    WORK_CONCENTRATION("Difficulty concentrating at work");

    private final String label;

    Symptom(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isCognitive() {
        return this == COGNITIVE_FOG || this == MEMORY_PROBLEMS;
    }

    public static Symptom fromLabel(String label) {
        for (Symptom symptom : values()) {
            if (symptom.label.equalsIgnoreCase(label)) return symptom;
        }
        throw new IllegalArgumentException("Unknown symptom: " + label);
    }
}
