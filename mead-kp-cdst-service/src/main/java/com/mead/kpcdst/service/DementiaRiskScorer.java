package com.mead.kpcdst.service;

import com.mead.kpcdst.dto.AssessmentDto.ContributingFactor;
import com.mead.kpcdst.dto.AssessmentDto.DementiaRiskResult;
import com.mead.kpcdst.model.ApoeStatus;
import com.mead.kpcdst.model.DementiaRiskLevel;
import com.mead.kpcdst.model.KpRiskLevel;
import com.mead.kpcdst.model.NeuroimagingFindings;
import com.mead.kpcdst.model.NeurovascularLevel;
import com.mead.kpcdst.model.PatientProfile;
import com.mead.kpcdst.model.RiskFactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Dual-track dementia risk: classical menopause and KP factors, plus ARIA-H neuroimaging
 * markers and APOE genotype.
 */
@Service
public class DementiaRiskScorer {

    private static final Logger log = LoggerFactory.getLogger(DementiaRiskScorer.class);

    private static final int MANY_MICROBLEEDS = 5;

    public DementiaRiskResult score(PatientProfile profile) {
        return score(profile, Optional.empty());
    }

    /**
     * @param kpLevel KP risk level; empty when no biomarkers were measured
     */
    public DementiaRiskResult score(PatientProfile profile, Optional<KpRiskLevel> kpLevel) {
        List<DementiaRule> triggered = new ArrayList<>();
        List<ContributingFactor> factors = new ArrayList<>();

        if (profile.hasRiskFactor(RiskFactor.BILATERAL_OOPHORECTOMY)) trigger(DementiaRule.BILATERAL_OOPHORECTOMY, triggered, factors);
        if (profile.hasRiskFactor(RiskFactor.EARLY_MENOPAUSE)) trigger(DementiaRule.EARLY_MENOPAUSE, triggered, factors);
        if (profile.hasRiskFactor(RiskFactor.FAMILY_HISTORY_DEMENTIA)) trigger(DementiaRule.FAMILY_HISTORY, triggered, factors);
        if (profile.hasRiskFactor(RiskFactor.NO_CURRENT_MHT)) trigger(DementiaRule.NO_MHT, triggered, factors);
        kpLevel.ifPresent(level -> {
            if (level == KpRiskLevel.HIGH) {
                trigger(DementiaRule.KP_HIGH, triggered, factors);
            } else if (level == KpRiskLevel.MODERATE) {
                trigger(DementiaRule.KP_MODERATE, triggered, factors);
            }
        });
        if (profile.hasCognitiveSymptoms()) trigger(DementiaRule.COGNITIVE_SYMPTOMS, triggered, factors);

        if (profile.neuroimaging().isPresent()) {
            NeuroimagingFindings imaging = profile.neuroimaging().get();
            int count = imaging.microbleedCount();
            if (count >= MANY_MICROBLEEDS) {
                trigger(DementiaRule.MICROBLEEDS_MANY, count + " " + DementiaRule.MICROBLEEDS_MANY.effectSize(), triggered, factors);
            } else if (count >= 1) {
                trigger(DementiaRule.MICROBLEEDS_FEW, count + " " + DementiaRule.MICROBLEEDS_FEW.effectSize(), triggered, factors);
            }
            if (imaging.whiteMatterChanges()) trigger(DementiaRule.WHITE_MATTER_CHANGES, triggered, factors);
            if (imaging.siderosis()) trigger(DementiaRule.SIDEROSIS, triggered, factors);
        }

        if (profile.apoeStatus() == ApoeStatus.HOMOZYGOUS) {
            trigger(DementiaRule.APOE_HOMOZYGOUS, triggered, factors);
        } else if (profile.apoeStatus() == ApoeStatus.HETEROZYGOUS) {
            trigger(DementiaRule.APOE_HETEROZYGOUS, triggered, factors);
        }

        int classical = sumPoints(triggered, DementiaRule.Track.CLASSICAL);
        int neurovascular = sumPoints(triggered, DementiaRule.Track.NEUROVASCULAR);
        int combined = classical + neurovascular;

        DementiaRiskResult result = new DementiaRiskResult(
                classical,
                neurovascular,
                combined,
                neurovascularLevel(neurovascular),
                combinedLevel(combined),
                factors
        );
        log.debug("Dementia risk classical={} neurovascular={} combined={} ({})",
                classical, neurovascular, combined, result.combinedLevel());
        return result;
    }

    public static NeurovascularLevel neurovascularLevel(int neurovascularScore) {
        if (neurovascularScore >= 5) return NeurovascularLevel.HIGH;
        if (neurovascularScore >= 2) return NeurovascularLevel.MODERATE;
        return NeurovascularLevel.LOW;
    }

    public static DementiaRiskLevel combinedLevel(int combinedScore) {
        if (combinedScore >= 10) return DementiaRiskLevel.CRITICAL;
        if (combinedScore >= 6) return DementiaRiskLevel.ELEVATED;
        if (combinedScore >= 3) return DementiaRiskLevel.MODERATE;
        return DementiaRiskLevel.POPULATION_LEVEL;
    }

    private static void trigger(DementiaRule rule, List<DementiaRule> triggered, List<ContributingFactor> factors) {
        trigger(rule, rule.effectSize(), triggered, factors);
    }

    private static void trigger(DementiaRule rule, String effectSize,
                                List<DementiaRule> triggered, List<ContributingFactor> factors) {
        triggered.add(rule);
        factors.add(new ContributingFactor(rule.factor(), effectSize, rule.source(), rule.points()));
    }

    private static int sumPoints(List<DementiaRule> triggered, DementiaRule.Track track) {
        return triggered.stream()
                .filter(rule -> rule.track() == track)
                .mapToInt(DementiaRule::points)
                .sum();
    }
}
