package com.mead.kpcdst.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LabelParsingTest {

    @Test
    void knownLabelsResolve() {
        assertThat(Symptom.fromLabel("Hot flushes/VMS")).isEqualTo(Symptom.VASOMOTOR);
        assertThat(RiskFactor.fromLabel("Bilateral oophorectomy")).isEqualTo(RiskFactor.BILATERAL_OOPHORECTOMY);
        assertThat(MenopausalStage.fromLabel("Late postmenopause (>5yr)")).isEqualTo(MenopausalStage.LATE_POSTMENOPAUSE);
        assertThat(ApoeStatus.fromLabel("Heterozygous (e3/e4)")).isEqualTo(ApoeStatus.HETEROZYGOUS);
        assertThat(Treatment.fromLabel("MHT (HRT)")).isEqualTo(Treatment.MHT);
        assertThat(SampleType.fromLabel("plasma")).isEqualTo(SampleType.PLASMA);
        assertThat(NormPopulation.fromLabel("regional")).isEqualTo(NormPopulation.REGIONAL);
        assertThat(EvidenceGrade.fromLabel("GAP")).isEqualTo(EvidenceGrade.GAP);
    }

    @Test
    void unknownSymptom_failsFast() {
        assertThatThrownBy(() -> Symptom.fromLabel("Headache"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown symptom: Headache");
    }

    @Test
    void unknownSampleType_failsFast() {
        assertThatThrownBy(() -> SampleType.fromLabel("urine"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown sample type: urine");
    }

    @Test
    void unknownTreatment_failsFast() {
        assertThatThrownBy(() -> Treatment.fromLabel("Acupuncture"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownApoeStatus_failsFast() {
        assertThatThrownBy(() -> ApoeStatus.fromLabel("e2/e2"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownPopulationAndRiskFactor_failFast() {
        assertThatThrownBy(() -> NormPopulation.fromLabel("european"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RiskFactor.fromLabel("Smoking"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
