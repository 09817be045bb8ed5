package com.mead.kpcdst.model;

/**
 * Static cost and evidence entry for one treatment. Costs are whole AUD per year.
 */
public record TreatmentOption(
        Treatment treatment,
        String name,
        long annualCost,
        long rebate,
        long outOfPocket,
        EvidenceGrade moodEvidence,
        EvidenceGrade cognitionEvidence,
        String description,
        EvidenceProfile evidenceProfile
) {

    /**
     * Domain scores on a 0-10 scale, higher is stronger evidence or better performance.
     */
    public record EvidenceProfile(
            int mood,
            int cognition,
            int vasomotor,
            int costEffectiveness,
            int access,
            int safety
    ) {}
}
