package com.mead.kpcdst.service;

import com.mead.kpcdst.config.DementiaCostProperties;
import com.mead.kpcdst.dto.AssessmentDto.DementiaCostAvoidance;
import com.mead.kpcdst.model.NeurovascularLevel;
import org.springframework.stereotype.Service;

/**
 * Avoidable lifetime dementia cost for the whole population versus a screened high-risk
 * subgroup (ARIA-H positive and KP-dysregulated).
 */
@Service
public class DementiaCostAvoidanceCalculator {

    private final DementiaCostProperties properties;

    public DementiaCostAvoidanceCalculator(DementiaCostProperties properties) {
        this.properties = properties;
    }

    public DementiaCostAvoidance estimate(NeurovascularLevel level) {
        return estimate(
                properties.populationAttributableFraction(),
                properties.subgroupFractions().forLevel(level),
                properties.subgroupSize()
        );
    }

    public DementiaCostAvoidance estimate(double populationFraction, double subgroupFraction, long subgroupSize) {
        requireFraction(populationFraction, "Population attributable fraction");
        requireFraction(subgroupFraction, "Subgroup attributable fraction");
        if (subgroupSize <= 0) {
            throw new IllegalArgumentException("Subgroup size must be positive: " + subgroupSize);
        }

        long lifetimeCost = properties.lifetimeCost();
        double populationAvoidable = properties.populationSize() * populationFraction * lifetimeCost;
        double subgroupAvoidable = subgroupSize * subgroupFraction * lifetimeCost;
        long perPatientValue = CostOffsetCalculator.roundHalfEven(subgroupFraction * lifetimeCost);

        return new DementiaCostAvoidance(
                properties.populationSize(),
                populationFraction,
                populationAvoidable,
                subgroupSize,
                subgroupFraction,
                subgroupAvoidable,
                perPatientValue,
                perPatientValue > properties.stronglyCostEffectiveThreshold()
        );
    }

    private static void requireFraction(double fraction, String name) {
        if (fraction < 0 || fraction > 1) {
            throw new IllegalArgumentException(name + " must be within [0, 1]: " + fraction);
        }
    }
}
