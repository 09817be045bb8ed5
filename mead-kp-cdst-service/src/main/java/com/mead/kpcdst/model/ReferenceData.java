package com.mead.kpcdst.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable population norms, regression coefficients and treatment tables.
 * Built once at start-up and injected into every engine component.
 */
public record ReferenceData(
        List<NormativeReference> norms,
        List<RegressionCoefficient> ageEffects,
        List<RegressionCoefficient> sexEffects,
        List<TreatmentOption> treatments,
        List<KpLinkedCondition> conditions
) {
    public ReferenceData {
        norms = List.copyOf(norms);
        ageEffects = List.copyOf(ageEffects);
        sexEffects = List.copyOf(sexEffects);
        conditions = List.copyOf(conditions);

        List<TreatmentOption> ordered = new ArrayList<>(treatments);
        ordered.sort(Comparator.comparing(TreatmentOption::treatment));
        treatments = List.copyOf(ordered);

        requireComplete(norms, ageEffects, treatments);
    }

    public NormativeReference norm(Metabolite metabolite, SampleType sampleType, NormPopulation population) {
        return norms.stream()
                .filter(n -> n.metabolite() == metabolite && n.sampleType() == sampleType && n.population() == population)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown normative reference: " + population + "/" + sampleType + "/" + metabolite));
    }

    public RegressionCoefficient ageEffect(Metabolite metabolite, SampleType sampleType) {
        return findCoefficient(ageEffects, metabolite, sampleType)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown age effect: " + sampleType + "/" + metabolite));
    }

    public Optional<RegressionCoefficient> sexEffect(Metabolite metabolite, SampleType sampleType) {
        return findCoefficient(sexEffects, metabolite, sampleType);
    }

    public TreatmentOption treatment(Treatment treatment) {
        return treatments.stream()
                .filter(t -> t.treatment() == treatment)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown treatment: " + treatment));
    }

    private static Optional<RegressionCoefficient> findCoefficient(List<RegressionCoefficient> table,
                                                                   Metabolite metabolite,
                                                                   SampleType sampleType) {
        return table.stream()
                .filter(c -> c.metabolite() == metabolite && c.sampleType() == sampleType)
                .findFirst();
    }

    private static void requireComplete(List<NormativeReference> norms,
                                        List<RegressionCoefficient> ageEffects,
                                        List<TreatmentOption> treatments) {
        for (Metabolite metabolite : Metabolite.values()) {
            for (SampleType sampleType : SampleType.values()) {
                boolean hasAgeEffect = findCoefficient(ageEffects, metabolite, sampleType).isPresent();
                if (!hasAgeEffect) {
                    throw new IllegalStateException("Missing age effect for " + sampleType + "/" + metabolite);
                }
                for (NormPopulation population : NormPopulation.values()) {
                    boolean present = norms.stream().anyMatch(n -> n.metabolite() == metabolite
                            && n.sampleType() == sampleType
                            && n.population() == population);
                    if (!present) {
                        throw new IllegalStateException(
                                "Missing normative reference for " + population + "/" + sampleType + "/" + metabolite);
                    }
                }
            }
        }
        for (Treatment treatment : Treatment.values()) {
            if (treatments.stream().noneMatch(t -> t.treatment() == treatment)) {
                throw new IllegalStateException("Missing treatment option: " + treatment.label());
            }
        }
    }
}
