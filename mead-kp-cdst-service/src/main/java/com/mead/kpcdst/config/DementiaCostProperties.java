package com.mead.kpcdst.config;

import com.mead.kpcdst.model.NeurovascularLevel;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "mead.dementia")
public record DementiaCostProperties(
        @Positive long lifetimeCost,
        @Positive long populationSize,
        @DecimalMin("0.0") @DecimalMax("1.0") double populationAttributableFraction,
        @Positive long subgroupSize,
        @Positive long stronglyCostEffectiveThreshold,
        @Valid @NotNull SubgroupFractions subgroupFractions
) {

    /**
     * Default attributable fraction for the precision subgroup, by neurovascular level.
     */
    public record SubgroupFractions(
            @DecimalMin("0.0") @DecimalMax("1.0") double high,
            @DecimalMin("0.0") @DecimalMax("1.0") double moderate,
            @DecimalMin("0.0") @DecimalMax("1.0") double low
    ) {
        public double forLevel(NeurovascularLevel level) {
            return switch (level) {
                case HIGH -> high;
                case MODERATE -> moderate;
                case LOW -> low;
            };
        }
    }
}
