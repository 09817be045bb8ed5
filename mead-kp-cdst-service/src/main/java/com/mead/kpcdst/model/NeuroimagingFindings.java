package com.mead.kpcdst.model;

/**
 * MRI findings: cerebral microbleed count, moderate-severe white matter hyperintensities
 * (Fazekas 2-3) and cortical superficial siderosis.
 */
public record NeuroimagingFindings(
        int microbleedCount,
        boolean whiteMatterChanges,
        boolean siderosis
) {
    public NeuroimagingFindings {
        if (microbleedCount < 0) {
            throw new IllegalArgumentException("Microbleed count must not be negative: " + microbleedCount);
        }
    }
}
