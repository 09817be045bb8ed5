package com.mead.kpcdst.service;

import com.mead.kpcdst.dto.AssessmentDto.KpRiskResult;
import com.mead.kpcdst.dto.AssessmentDto.TreatmentRanking;
import com.mead.kpcdst.dto.AssessmentDto.TreatmentScore;
import com.mead.kpcdst.model.KpRiskLevel;
import com.mead.kpcdst.model.MenopausalStage;
import com.mead.kpcdst.model.PatientProfile;
import com.mead.kpcdst.model.ReferenceData;
import com.mead.kpcdst.model.Symptom;
import com.mead.kpcdst.model.Treatment;
import com.mead.kpcdst.model.TreatmentOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ranks every treatment option by a clamped additive suitability score.
 */
@Service
public class TreatmentRanker {

    private static final Logger log = LoggerFactory.getLogger(TreatmentRanker.class);

    private final ReferenceData referenceData;

    public TreatmentRanker(ReferenceData referenceData) {
        this.referenceData = referenceData;
    }

    /**
     * @param kpRisk KP result; empty when no biomarkers were measured (no risk-level rule applies)
     */
    public TreatmentRanking rank(PatientProfile profile, Optional<KpRiskResult> kpRisk) {
        return rank(kpRisk.map(KpRiskResult::level), profile.symptoms(), profile.age(), profile.stage());
    }

    public TreatmentRanking rank(Optional<KpRiskLevel> level, Set<Symptom> symptoms, int age, MenopausalStage stage) {
        List<Map<Treatment, Integer>> adjustments = new ArrayList<>();
        level.ifPresent(l -> adjustments.add(TreatmentRules.forRiskLevel(l)));
        for (Symptom symptom : symptoms) {
            adjustments.add(TreatmentRules.forSymptom(symptom));
        }
        adjustments.add(TreatmentRules.forStage(stage));
        adjustments.add(TreatmentRules.forAge(age));

        List<TreatmentScore> scores = new ArrayList<>();
        for (TreatmentOption option : referenceData.treatments()) {
            int score = TreatmentRules.BASE_SCORE;
            for (Map<Treatment, Integer> adjustment : adjustments) {
                score += adjustment.getOrDefault(option.treatment(), 0);
            }
            scores.add(new TreatmentScore(option.treatment(), clamp(score)));
        }

        // List.sort is stable, so equal scores keep table order.
        scores.sort(Comparator.comparingInt(TreatmentScore::score).reversed());

        TreatmentRanking ranking = new TreatmentRanking(scores);
        log.debug("Ranked treatments for level {}: top {} ({})", level.map(Enum::name).orElse("n/a"), ranking.top().treatment(), ranking.top().score());
        return ranking;
    }

    static int clamp(int score) {
        return Math.max(TreatmentRules.MIN_SCORE, Math.min(TreatmentRules.MAX_SCORE, score));
    }
}
