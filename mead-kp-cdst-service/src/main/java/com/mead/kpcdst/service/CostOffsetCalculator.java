package com.mead.kpcdst.service;

import com.mead.kpcdst.config.CostModelProperties;
import com.mead.kpcdst.config.CostModelProperties.ProductivityComponents;
import com.mead.kpcdst.dto.AssessmentDto.CostOffset;
import com.mead.kpcdst.dto.AssessmentDto.KpRiskResult;
import com.mead.kpcdst.dto.AssessmentDto.PopulationImpact;
import com.mead.kpcdst.dto.AssessmentDto.ProductivityLossBreakdown;
import com.mead.kpcdst.model.ReferenceData;
import com.mead.kpcdst.model.Treatment;
import com.mead.kpcdst.model.TreatmentOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Productivity-offset economics per treatment, and national scaling of the chosen treatment.
 * Amounts are whole AUD per year; rounding is half-even.
 */
@Service
public class CostOffsetCalculator {

    private static final Logger log = LoggerFactory.getLogger(CostOffsetCalculator.class);

    private final ReferenceData referenceData;
    private final CostModelProperties costModel;

    public CostOffsetCalculator(ReferenceData referenceData, CostModelProperties costModel) {
        this.referenceData = referenceData;
        this.costModel = costModel;
    }

    /**
     * iTBS efficacy rises when biomarkers show HIGH or MODERATE KP risk.
     *
     * @param kpRisk KP result; empty when no biomarkers were measured
     */
    public double efficacy(Treatment treatment, Optional<KpRiskResult> kpRisk) {
        boolean targeted = kpRisk.map(risk -> risk.level().isElevated()).orElse(false);
        return costModel.efficacy().forTreatment(treatment, targeted);
    }

    public List<CostOffset> offsets(Optional<KpRiskResult> kpRisk) {
        return referenceData.treatments().stream()
                .map(option -> offset(option.treatment(), kpRisk))
                .toList();
    }

    public CostOffset offset(Treatment treatment, Optional<KpRiskResult> kpRisk) {
        return offset(referenceData.treatment(treatment), efficacy(treatment, kpRisk));
    }

    public CostOffset offset(TreatmentOption option, double efficacy) {
        long annualCost = option.annualCost();
        long productivityOffset = roundHalfEven(costModel.perWomanIndirectLoss() * efficacy);
        long netCost = annualCost - productivityOffset;
        double roi = annualCost > 0 ? ((double) productivityOffset / annualCost - 1) * 100 : 0;
        double breakEvenYears = productivityOffset > 0
                ? (double) annualCost / productivityOffset
                : Double.POSITIVE_INFINITY;

        return new CostOffset(option.treatment(), annualCost, efficacy, productivityOffset, netCost, roi, breakEvenYears);
    }

    public PopulationImpact populationImpact(Treatment treatment, Optional<KpRiskResult> kpRisk) {
        return populationImpact(treatment, kpRisk, costModel.defaultUptakeFraction());
    }

    public PopulationImpact populationImpact(Treatment treatment, Optional<KpRiskResult> kpRisk, double uptakeFraction) {
        if (uptakeFraction < costModel.minUptakeFraction() || uptakeFraction > costModel.maxUptakeFraction()) {
            throw new IllegalArgumentException("Uptake fraction " + uptakeFraction + " outside ["
                    + costModel.minUptakeFraction() + ", " + costModel.maxUptakeFraction() + "]");
        }

        CostOffset perPatient = offset(treatment, kpRisk);
        long eligible = costModel.eligiblePopulation();
        long treated = roundHalfEven(eligible * uptakeFraction);
        long nationalOffset = treated * perPatient.productivityOffset();
        long nationalCost = treated * perPatient.annualCost();
        long nationalNet = nationalCost - nationalOffset;

        log.debug("National scaling for {}: treated={} offset={} net={}", treatment, treated, nationalOffset, nationalNet);
        return new PopulationImpact(treatment, eligible, uptakeFraction, treated, nationalOffset, nationalCost, nationalNet);
    }

    public ProductivityLossBreakdown productivityLoss() {
        ProductivityComponents components = costModel.productivityComponents();
        return new ProductivityLossBreakdown(
                components.employeeAbsenteeism(),
                components.employerAbsenteeism(),
                components.employeePresenteeism(),
                components.employerPresenteeism(),
                components.workplaceEnvironment()
        );
    }

    static long roundHalfEven(double value) {
        return (long) Math.rint(value);
    }
}
