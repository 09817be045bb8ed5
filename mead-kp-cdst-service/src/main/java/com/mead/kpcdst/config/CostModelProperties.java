package com.mead.kpcdst.config;

import com.mead.kpcdst.model.Treatment;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Productivity-offset and national scaling assumptions. All money values are whole AUD per year.
 */
@Validated
@ConfigurationProperties(prefix = "mead.cost-model")
public record CostModelProperties(
        @Positive long perWomanIndirectLoss,
        @Positive long eligiblePopulation,
        @DecimalMin("0.0") @DecimalMax("1.0") double defaultUptakeFraction,
        @DecimalMin("0.0") @DecimalMax("1.0") double minUptakeFraction,
        @DecimalMin("0.0") @DecimalMax("1.0") double maxUptakeFraction,
        @Valid @NotNull Efficacy efficacy,
        @Valid @NotNull ProductivityComponents productivityComponents
) {

    /**
     * Assumed fractional reduction of productivity loss per treatment. iTBS has a higher
     * value when KP biomarkers select the patient.
     */
    public record Efficacy(
            @DecimalMin("0.0") @DecimalMax("1.0") double itbsTargeted,
            @DecimalMin("0.0") @DecimalMax("1.0") double itbsUntargeted,
            @DecimalMin("0.0") @DecimalMax("1.0") double mht,
            @DecimalMin("0.0") @DecimalMax("1.0") double ssriSnri,
            @DecimalMin("0.0") @DecimalMax("1.0") double cbt,
            @DecimalMin("0.0") @DecimalMax("1.0") double monitoring
    ) {
        public double forTreatment(Treatment treatment, boolean biomarkerTargeted) {
            return switch (treatment) {
                case ITBS -> biomarkerTargeted ? itbsTargeted : itbsUntargeted;
                case MHT -> mht;
                case SSRI_SNRI -> ssriSnri;
                case CBT -> cbt;
                case MONITORING -> monitoring;
            };
        }
    }

    public record ProductivityComponents(
            @PositiveOrZero long employeeAbsenteeism,
            @PositiveOrZero long employerAbsenteeism,
            @PositiveOrZero long employeePresenteeism,
            @PositiveOrZero long employerPresenteeism,
            @PositiveOrZero long workplaceEnvironment
    ) {}
}
