package com.mead.kpcdst.service;

/**
 * Dementia risk checklist: label, effect size, citation and points per rule, in trigger order.
 */
public enum DementiaRule {

    // Classical track
    BILATERAL_OOPHORECTOMY(Track.CLASSICAL, "Bilateral oophorectomy <menopause", "HR = 1.46", "Rocca 2007", 3),
    EARLY_MENOPAUSE(Track.CLASSICAL, "Early menopause (<45)", "aOR = 2.21 for MCI", "Rocca 2021", 3),
    FAMILY_HISTORY(Track.CLASSICAL, "Family history", "OR ~2.0", "Literature", 2),
    NO_MHT(Track.CLASSICAL, "No MHT during critical window", "~30% risk reduction missed", "Maki 2013", 1),
    KP_HIGH(Track.CLASSICAL, "KP dysregulation (HIGH)", "Neurotoxic shift", "Metri 2023 + Giil 2016", 2),
    KP_MODERATE(Track.CLASSICAL, "KP activation (MODERATE)", "Elevated KYN/TRP", "Metri 2023", 1),
    COGNITIVE_SYMPTOMS(Track.CLASSICAL, "Current cognitive symptoms", "Subjective", "Self-report", 1),

    // Neurovascular (ARIA-H) track; microbleed effect size is prefixed with the count
    MICROBLEEDS_MANY(Track.NEUROVASCULAR, "Cerebral microbleeds (>=5)", "CMBs on MRI", "ARIA-H literature", 3),
    MICROBLEEDS_FEW(Track.NEUROVASCULAR, "Cerebral microbleeds (1-4)", "CMBs on MRI", "ARIA-H literature", 2),
    WHITE_MATTER_CHANGES(Track.NEUROVASCULAR, "WMH (Fazekas 2-3)", "BBB compromise marker", "Cerebrovascular lit.", 2),
    SIDEROSIS(Track.NEUROVASCULAR, "Superficial siderosis", "CAA marker — high BBB vulnerability", "ARIA-H literature", 3),
    APOE_HOMOZYGOUS(Track.NEUROVASCULAR, "APOE e4/e4 homozygous", "OR ~12 for AD; BBB permeability", "Literature", 3),
    APOE_HETEROZYGOUS(Track.NEUROVASCULAR, "APOE e3/e4 heterozygous", "OR ~3.2 for AD", "Literature", 2);

    public enum Track { CLASSICAL, NEUROVASCULAR }

    private final Track track;
    private final String factor;
    private final String effectSize;
    private final String source;
    private final int points;

    DementiaRule(Track track, String factor, String effectSize, String source, int points) {
        this.track = track;
        this.factor = factor;
        this.effectSize = effectSize;
        this.source = source;
        this.points = points;
    }

    public Track track() {
        return track;
    }

    public String factor() {
        return factor;
    }

    public String effectSize() {
        return effectSize;
    }

    public String source() {
        return source;
    }

    public int points() {
        return points;
    }
}
