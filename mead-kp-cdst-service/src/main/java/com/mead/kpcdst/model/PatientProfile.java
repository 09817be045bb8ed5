package com.mead.kpcdst.model;

import lombok.Builder;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One assessment request. Biomarkers and neuroimaging are optional; rules that depend on
 * them are skipped when they are absent.
 */
@Builder
public record PatientProfile(
        int age,
        MenopausalStage stage,
        Set<Symptom> symptoms,
        Set<RiskFactor> riskFactors,
        Optional<BiomarkerPanel> biomarkers,
        Optional<NeuroimagingFindings> neuroimaging,
        ApoeStatus apoeStatus
) {
    public PatientProfile {
        Objects.requireNonNull(stage, "Menopausal stage is required");
        symptoms = immutableCopy(symptoms, Symptom.class);
        riskFactors = immutableCopy(riskFactors, RiskFactor.class);
        if (biomarkers == null) biomarkers = Optional.empty();
        if (neuroimaging == null) neuroimaging = Optional.empty();
        if (apoeStatus == null) apoeStatus = ApoeStatus.UNKNOWN;
    }

    public boolean hasRiskFactor(RiskFactor riskFactor) {
        return riskFactors.contains(riskFactor);
    }

    public boolean hasCognitiveSymptoms() {
        return symptoms.stream().anyMatch(Symptom::isCognitive);
    }

    private static <E extends Enum<E>> Set<E> immutableCopy(Set<E> values, Class<E> type) {
        if (values == null || values.isEmpty()) return Collections.unmodifiableSet(EnumSet.noneOf(type));
        return Collections.unmodifiableSet(EnumSet.copyOf(values));
    }
}
