package com.mead.kpcdst.service;

import com.mead.kpcdst.config.CostModelProperties;
import com.mead.kpcdst.dto.AssessmentDto.ClinicalAssessment;
import com.mead.kpcdst.dto.AssessmentDto.CostOffset;
import com.mead.kpcdst.dto.AssessmentDto.DementiaCostAvoidance;
import com.mead.kpcdst.dto.AssessmentDto.DementiaRiskResult;
import com.mead.kpcdst.dto.AssessmentDto.KpRiskResult;
import com.mead.kpcdst.dto.AssessmentDto.PopulationImpact;
import com.mead.kpcdst.dto.AssessmentDto.TreatmentRanking;
import com.mead.kpcdst.model.KpRiskLevel;
import com.mead.kpcdst.model.PatientProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs the full assessment pipeline for one patient profile.
 */
@Service
public class ClinicalAssessmentService {

    private static final Logger log = LoggerFactory.getLogger(ClinicalAssessmentService.class);

    private final KpRiskClassifier classifier;
    private final TreatmentRanker ranker;
    private final CostOffsetCalculator costCalculator;
    private final DementiaRiskScorer dementiaScorer;
    private final DementiaCostAvoidanceCalculator avoidanceCalculator;
    private final CostModelProperties costModel;

    public ClinicalAssessmentService(KpRiskClassifier classifier,
                                     TreatmentRanker ranker,
                                     CostOffsetCalculator costCalculator,
                                     DementiaRiskScorer dementiaScorer,
                                     DementiaCostAvoidanceCalculator avoidanceCalculator,
                                     CostModelProperties costModel) {
        this.classifier = classifier;
        this.ranker = ranker;
        this.costCalculator = costCalculator;
        this.dementiaScorer = dementiaScorer;
        this.avoidanceCalculator = avoidanceCalculator;
        this.costModel = costModel;
    }

    public ClinicalAssessment assess(PatientProfile profile) {
        return assess(profile, costModel.defaultUptakeFraction());
    }

    public ClinicalAssessment assess(PatientProfile profile, double uptakeFraction) {
        Optional<KpRiskResult> kpRisk = profile.biomarkers()
                .map(panel -> classifier.classify(panel, profile.age()));
        Optional<KpRiskLevel> kpLevel = kpRisk.map(KpRiskResult::level);

        TreatmentRanking ranking = ranker.rank(profile, kpRisk);
        List<CostOffset> offsets = costCalculator.offsets(kpRisk);
        PopulationImpact impact = costCalculator.populationImpact(ranking.top().treatment(), kpRisk, uptakeFraction);

        DementiaRiskResult dementiaRisk = dementiaScorer.score(profile, kpLevel);
        DementiaCostAvoidance avoidance = avoidanceCalculator.estimate(dementiaRisk.neurovascularLevel());

        log.debug("Assessment: KP={} top={} dementia={}",
                kpLevel.map(Enum::name).orElse("n/a"), ranking.top().treatment(), dementiaRisk.combinedLevel());

        return new ClinicalAssessment(profile, kpRisk, ranking, offsets, impact, dementiaRisk, avoidance);
    }
}
