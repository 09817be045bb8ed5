package com.mead.kpcdst.service;

import com.mead.kpcdst.dto.AssessmentDto.KpRiskResult;
import com.mead.kpcdst.model.BiomarkerPanel;
import com.mead.kpcdst.model.KpRiskLevel;
import com.mead.kpcdst.model.Metabolite;
import com.mead.kpcdst.model.NormPopulation;
import com.mead.kpcdst.model.NormativeReference;
import com.mead.kpcdst.model.ReferenceData;
import com.mead.kpcdst.model.SampleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import static com.mead.kpcdst.service.BiomarkerNormalizer.ageAdjust;
import static com.mead.kpcdst.service.BiomarkerNormalizer.zScore;

/**
 * Scores TRP, KYN and the KYN/TRP ratio against age-adjusted norms and classifies the
 * composite into a {@link KpRiskLevel}.
 */
@Service
public class KpRiskClassifier {

    private static final Logger log = LoggerFactory.getLogger(KpRiskClassifier.class);

    // Uncalibrated modeling constants: assumed ratio coefficient of variation and composite divisor.
    static final double RATIO_CV = 0.25;
    static final double COMPOSITE_DIVISOR = 3;

    static final double HIGH_THRESHOLD = 1.5;
    static final double MODERATE_THRESHOLD = 0.5;
    static final double LOW_MODERATE_THRESHOLD = -0.5;

    private final ReferenceData referenceData;

    public KpRiskClassifier(ReferenceData referenceData) {
        this.referenceData = referenceData;
    }

    public KpRiskResult classify(BiomarkerPanel panel, int age) {
        return score(panel, age);
    }

    /**
     * Raw-value entry point; values are validated as a {@link BiomarkerPanel}.
     */
    public KpRiskResult classify(double trp, double kyn, SampleType sampleType, NormPopulation population, double age) {
        return score(new BiomarkerPanel(sampleType, population, trp, kyn), age);
    }

    private KpRiskResult score(BiomarkerPanel panel, double age) {
        double trp = panel.trp();
        double kyn = panel.kyn();
        SampleType sampleType = panel.sampleType();
        NormPopulation population = panel.population();

        NormativeReference trpNorm = referenceData.norm(Metabolite.TRP, sampleType, population);
        NormativeReference kynNorm = referenceData.norm(Metabolite.KYN, sampleType, population);

        double adjustedTrpMean = ageAdjust(age, trpNorm.mean(), referenceData.ageEffect(Metabolite.TRP, sampleType).beta());
        double adjustedKynMean = ageAdjust(age, kynNorm.mean(), referenceData.ageEffect(Metabolite.KYN, sampleType).beta());

        double trpZ = zScore(trp, adjustedTrpMean, trpNorm.standardDeviation());
        double kynZ = zScore(kyn, adjustedKynMean, kynNorm.standardDeviation());

        double ratio = 0;
        if (trp > 0) {
            ratio = kyn / trp;
        } else {
            log.debug("TRP is {}, KYN/TRP ratio set to 0", trp);
        }

        double normativeRatio = adjustedTrpMean > 0
                ? adjustedKynMean / adjustedTrpMean
                : kynNorm.mean() / trpNorm.mean();
        double ratioZ = (ratio - normativeRatio) / (normativeRatio * RATIO_CV);

        // Low TRP is the adverse direction, hence the sign flip.
        double composite = (-trpZ + kynZ + ratioZ) / COMPOSITE_DIVISOR;
        KpRiskLevel level = levelFor(composite);

        log.debug("KP composite {} ({} {}, age {}) -> {}", composite, population, sampleType, age, level);

        return new KpRiskResult(
                sampleType,
                population,
                trpZ,
                kynZ,
                ratio,
                normativeRatio,
                ratioZ,
                composite,
                level,
                level.interpretation(),
                trpNorm.mean(),
                kynNorm.mean(),
                adjustedTrpMean,
                adjustedKynMean
        );
    }

    public static KpRiskLevel levelFor(double composite) {
        if (composite > HIGH_THRESHOLD) return KpRiskLevel.HIGH;
        if (composite > MODERATE_THRESHOLD) return KpRiskLevel.MODERATE;
        if (composite > LOW_MODERATE_THRESHOLD) return KpRiskLevel.LOW_MODERATE;
        return KpRiskLevel.LOW;
    }
}
