package com.mead.kpcdst.model;

/**
 * Evidence grade A (strongest) to D, or GAP when no trial data exists.
 */
public enum EvidenceGrade {
    A, B, C, D, GAP;

    public static EvidenceGrade fromLabel(String label) {
        for (EvidenceGrade grade : values()) {
            if (grade.name().equalsIgnoreCase(label)) return grade;
        }
        throw new IllegalArgumentException("Unknown evidence grade: " + label);
    }
}
