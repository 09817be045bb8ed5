package com.mead.kpcdst.dto;

import com.mead.kpcdst.model.DementiaRiskLevel;
import com.mead.kpcdst.model.KpRiskLevel;
import com.mead.kpcdst.model.NeurovascularLevel;
import com.mead.kpcdst.model.NormPopulation;
import com.mead.kpcdst.model.PatientProfile;
import com.mead.kpcdst.model.SampleType;
import com.mead.kpcdst.model.Treatment;

import java.util.List;
import java.util.Optional;

public final class AssessmentDto {

    public record KpRiskResult(
            SampleType sampleType,
            NormPopulation population,
            double trpZ,
            double kynZ,
            double ratio,
            double normativeRatio,
            double ratioZ,
            double composite,
            KpRiskLevel level,
            String interpretation,
            double referenceTrpMean,
            double referenceKynMean,
            double adjustedTrpMean,
            double adjustedKynMean
    ) {}

    public record TreatmentScore(
            Treatment treatment,
            int score
    ) {}

    /**
     * Treatments by descending suitability score; equal scores keep reference table order.
     */
    public record TreatmentRanking(
            List<TreatmentScore> entries
    ) {
        public TreatmentRanking {
            entries = List.copyOf(entries);
        }

        public TreatmentScore top() {
            return entries.get(0);
        }

        public int scoreOf(Treatment treatment) {
            return entries.stream()
                    .filter(e -> e.treatment() == treatment)
                    .mapToInt(TreatmentScore::score)
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unranked treatment: " + treatment));
        }
    }

    public record ContributingFactor(
            String factor,
            String effectSize,
            String source,
            int points
    ) {}

    public record DementiaRiskResult(
            int classicalScore,
            int neurovascularScore,
            int combinedScore,
            NeurovascularLevel neurovascularLevel,
            DementiaRiskLevel combinedLevel,
            List<ContributingFactor> contributingFactors
    ) {
        public static final int CLASSICAL_MAX = 12;
        public static final int NEUROVASCULAR_MAX = 11;
        public static final int COMBINED_MAX = CLASSICAL_MAX + NEUROVASCULAR_MAX;

        public DementiaRiskResult {
            contributingFactors = List.copyOf(contributingFactors);
        }
    }

    /**
     * Per-treatment cost offset. {@code breakEvenYears} is positive infinity when the
     * productivity offset is zero and the cost is never recovered.
     */
    public record CostOffset(
            Treatment treatment,
            long annualCost,
            double efficacy,
            long productivityOffset,
            long netCost,
            double roiPercent,
            double breakEvenYears
    ) {
        public boolean breaksEven() {
            return Double.isFinite(breakEvenYears);
        }
    }

    public record PopulationImpact(
            Treatment treatment,
            long eligiblePopulation,
            double uptakeFraction,
            long treated,
            long nationalOffset,
            long nationalCost,
            long nationalNet
    ) {
        public boolean isSaving() {
            return nationalNet <= 0;
        }
    }

    public record DementiaCostAvoidance(
            long populationSize,
            double populationAttributableFraction,
            double populationAvoidableCost,
            long subgroupSize,
            double subgroupAttributableFraction,
            double subgroupAvoidableCost,
            long perPatientValue,
            boolean stronglyCostEffective
    ) {}

    /**
     * Stromberg decomposition of the annual per-woman productivity loss, whole AUD.
     */
    public record ProductivityLossBreakdown(
            long employeeAbsenteeism,
            long employerAbsenteeism,
            long employeePresenteeism,
            long employerPresenteeism,
            long workplaceEnvironment
    ) {
        public long total() {
            return employeeAbsenteeism + employerAbsenteeism + employeePresenteeism
                    + employerPresenteeism + workplaceEnvironment;
        }
    }

    public record ClinicalAssessment(
            PatientProfile profile,
            Optional<KpRiskResult> kpRisk,
            TreatmentRanking ranking,
            List<CostOffset> costOffsets,
            PopulationImpact populationImpact,
            DementiaRiskResult dementiaRisk,
            DementiaCostAvoidance dementiaCostAvoidance
    ) {
        public ClinicalAssessment {
            costOffsets = List.copyOf(costOffsets);
        }
    }

    private AssessmentDto() {}
}
