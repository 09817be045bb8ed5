package com.mead.kpcdst.service;

import com.mead.kpcdst.TestFixtures;
import com.mead.kpcdst.dto.AssessmentDto.ClinicalAssessment;
import com.mead.kpcdst.dto.AssessmentDto.KpRiskResult;
import com.mead.kpcdst.dto.AssessmentDto.TreatmentScore;
import com.mead.kpcdst.model.BiomarkerPanel;
import com.mead.kpcdst.model.DementiaRiskLevel;
import com.mead.kpcdst.model.KpRiskLevel;
import com.mead.kpcdst.model.MenopausalStage;
import com.mead.kpcdst.model.NeurovascularLevel;
import com.mead.kpcdst.model.NormPopulation;
import com.mead.kpcdst.model.PatientProfile;
import com.mead.kpcdst.model.ReferenceData;
import com.mead.kpcdst.model.SampleType;
import com.mead.kpcdst.model.Symptom;
import com.mead.kpcdst.model.Treatment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class ClinicalAssessmentServiceTest {

    private final ReferenceData referenceData = TestFixtures.referenceData();

    private KpRiskClassifier classifier;
    private ClinicalAssessmentService service;

    @BeforeEach
    void setUp() {
        classifier = mock(KpRiskClassifier.class);
        service = newService(classifier);
    }

    private ClinicalAssessmentService newService(KpRiskClassifier kpClassifier) {
        return new ClinicalAssessmentService(
                kpClassifier,
                new TreatmentRanker(referenceData),
                new CostOffsetCalculator(referenceData, TestFixtures.costModel()),
                new DementiaRiskScorer(),
                new DementiaCostAvoidanceCalculator(TestFixtures.dementiaCost()),
                TestFixtures.costModel()
        );
    }

    private static PatientProfile.PatientProfileBuilder perimenopausalWithFog() {
        return PatientProfile.builder()
                .age(51)
                .stage(MenopausalStage.LATE_PERIMENOPAUSE)
                .symptoms(Set.of(Symptom.COGNITIVE_FOG, Symptom.DEPRESSION));
    }

    @Test
    void withoutBiomarkers_skipsClassification() {
        ClinicalAssessment assessment = service.assess(perimenopausalWithFog().build());

        verifyNoInteractions(classifier);
        assertThat(assessment.kpRisk()).isEmpty();
        assertThat(assessment.ranking().top()).isEqualTo(new TreatmentScore(Treatment.ITBS, 75));
        assertThat(assessment.populationImpact().treatment()).isEqualTo(Treatment.ITBS);
        assertThat(assessment.populationImpact().nationalOffset()).isEqualTo(7_200L * 3_110);
        assertThat(assessment.dementiaRisk().classicalScore()).isEqualTo(1);
    }

    @Test
    void withoutBiomarkers_passesEmptyKpResultDownstream() {
        PatientProfile profile = perimenopausalWithFog().build();
        CostOffsetCalculator costCalculator = new CostOffsetCalculator(referenceData, TestFixtures.costModel());

        ClinicalAssessment assessment = service.assess(profile);

        assertThat(assessment.ranking()).isEqualTo(new TreatmentRanker(referenceData).rank(profile, Optional.empty()));
        assertThat(assessment.costOffsets()).isEqualTo(costCalculator.offsets(Optional.empty()));
        assertThat(assessment.dementiaRisk()).isEqualTo(new DementiaRiskScorer().score(profile, Optional.empty()));
    }

    @Test
    void withBiomarkers_classifiesOnceAndFeedsLevelDownstream() {
        BiomarkerPanel panel = BiomarkerPanel.of(SampleType.SERUM, 50, 3.2);
        KpRiskResult high = new KpRiskClassifier(referenceData)
                .classify(50, 3.2, SampleType.SERUM, NormPopulation.REGIONAL, 51);
        when(classifier.classify(panel, 51)).thenReturn(high);

        ClinicalAssessment assessment = service.assess(perimenopausalWithFog().biomarkers(Optional.of(panel)).build());

        verify(classifier, times(1)).classify(panel, 51);
        assertThat(assessment.kpRisk()).contains(high);
        assertThat(assessment.ranking().top()).isEqualTo(new TreatmentScore(Treatment.ITBS, 100));
        assertThat(assessment.dementiaRisk().classicalScore()).isEqualTo(3);
    }

    @Test
    void endToEnd_highKpRiskPerimenopausalPatient() {
        ClinicalAssessmentService real = newService(new KpRiskClassifier(referenceData));
        PatientProfile profile = perimenopausalWithFog()
                .biomarkers(Optional.of(BiomarkerPanel.of(SampleType.SERUM, 50, 3.2)))
                .build();

        ClinicalAssessment assessment = real.assess(profile);

        assertThat(assessment.kpRisk()).get()
                .extracting(KpRiskResult::level)
                .isEqualTo(KpRiskLevel.HIGH);
        assertThat(assessment.ranking().top()).isEqualTo(new TreatmentScore(Treatment.ITBS, 100));
        assertThat(assessment.costOffsets()).hasSize(5);
        assertThat(assessment.costOffsets().get(0).productivityOffset()).isEqualTo(5_702);

        assertThat(assessment.populationImpact().treated()).isEqualTo(7_200);
        assertThat(assessment.populationImpact().nationalOffset()).isEqualTo(41_054_400);
        assertThat(assessment.populationImpact().nationalCost()).isEqualTo(54_000_000);
        assertThat(assessment.populationImpact().nationalNet()).isEqualTo(12_945_600);

        assertThat(assessment.dementiaRisk().classicalScore()).isEqualTo(3);
        assertThat(assessment.dementiaRisk().combinedLevel()).isEqualTo(DementiaRiskLevel.MODERATE);
        assertThat(assessment.dementiaRisk().neurovascularLevel()).isEqualTo(NeurovascularLevel.LOW);
        assertThat(assessment.dementiaCostAvoidance().perPatientValue()).isEqualTo(22_100);
    }

    @Test
    void repeatedAssessments_areIdentical() {
        ClinicalAssessmentService real = newService(new KpRiskClassifier(referenceData));
        PatientProfile profile = perimenopausalWithFog()
                .biomarkers(Optional.of(BiomarkerPanel.of(SampleType.PLASMA, 35, 2.6)))
                .build();

        assertThat(real.assess(profile)).isEqualTo(real.assess(profile));
    }

    @Test
    void customUptake_isValidated() {
        PatientProfile profile = perimenopausalWithFog().build();

        assertThat(service.assess(profile, 0.10).populationImpact().treated()).isEqualTo(36_000);
        assertThatThrownBy(() -> service.assess(profile, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
