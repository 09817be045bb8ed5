package com.mead.kpcdst.service;

import com.mead.kpcdst.model.KpRiskLevel;
import com.mead.kpcdst.model.MenopausalStage;
import com.mead.kpcdst.model.Symptom;
import com.mead.kpcdst.model.Treatment;

import java.util.Map;

import static com.mead.kpcdst.model.Treatment.CBT;
import static com.mead.kpcdst.model.Treatment.ITBS;
import static com.mead.kpcdst.model.Treatment.MHT;
import static com.mead.kpcdst.model.Treatment.MONITORING;
import static com.mead.kpcdst.model.Treatment.SSRI_SNRI;

/**
 * Additive suitability adjustments per treatment. Every switch is exhaustive, so a new
 * level, symptom or stage does not compile until it has a rule (even an empty one).
 */
final class TreatmentRules {

    static final int BASE_SCORE = 50;
    static final int MIN_SCORE = 0;
    static final int MAX_SCORE = 100;
    static final int MONITORING_AGE_THRESHOLD = 55;

    private TreatmentRules() {}

    static Map<Treatment, Integer> forRiskLevel(KpRiskLevel level) {
        return switch (level) {
            // Strong dysregulation: brain stimulation most targeted; estrogen modulates KP
            case HIGH -> Map.of(ITBS, 30, MHT, 20, MONITORING, -20);
            case MODERATE -> Map.of(MHT, 20, ITBS, 10);
            case LOW -> Map.of(MONITORING, 20, ITBS, -15);
            case LOW_MODERATE -> Map.of();
        };
    }

    static Map<Treatment, Integer> forSymptom(Symptom symptom) {
        return switch (symptom) {
            // SSRIs may worsen cognitive symptoms
            case COGNITIVE_FOG -> Map.of(ITBS, 15, SSRI_SNRI, -10);
            case DEPRESSION -> Map.of(SSRI_SNRI, 15, CBT, 15, ITBS, 10);
            case ANXIETY -> Map.of(SSRI_SNRI, 10, CBT, 10);
            // MHT is first-line for VMS
            case VASOMOTOR -> Map.of(MHT, 25);
            case SLEEP_DISTURBANCE -> Map.of(MHT, 10, CBT, 5);
            case MEMORY_PROBLEMS, FATIGUE, WORK_CONCENTRATION -> Map.of();
        };
    }

    static Map<Treatment, Integer> forStage(MenopausalStage stage) {
        return switch (stage) {
            // Critical window for MHT
            case LATE_PERIMENOPAUSE -> Map.of(MHT, 10);
            case EARLY_POSTMENOPAUSE -> Map.of(MHT, 5);
            // Past the window; cognitive symptoms often resolve
            case LATE_POSTMENOPAUSE -> Map.of(MHT, -15, MONITORING, 10);
            case EARLY_PERIMENOPAUSE, SURGICAL_MENOPAUSE -> Map.of();
        };
    }

    static Map<Treatment, Integer> forAge(int age) {
        if (age > MONITORING_AGE_THRESHOLD) return Map.of(MONITORING, 5);
        return Map.of();
    }
}
