package com.mead.kpcdst.repository;

import com.mead.kpcdst.TestFixtures;
import com.mead.kpcdst.model.EvidenceGrade;
import com.mead.kpcdst.model.Metabolite;
import com.mead.kpcdst.model.NormPopulation;
import com.mead.kpcdst.model.NormativeReference;
import com.mead.kpcdst.model.ReferenceData;
import com.mead.kpcdst.model.SampleType;
import com.mead.kpcdst.model.Treatment;
import com.mead.kpcdst.model.TreatmentOption;
import com.mead.kpcdst.model.TreatmentOption.EvidenceProfile;
import com.mead.kpcdst.rdf.RdfService;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ReferenceDataRepositoryTest {

    private final ReferenceData referenceData = TestFixtures.referenceData();

    @Test
    void loadsAllNormativeReferences() {
        assertThat(referenceData.norms()).hasSize(8);

        NormativeReference serumTrp = referenceData.norm(Metabolite.TRP, SampleType.SERUM, NormPopulation.REGIONAL);
        assertThat(serumTrp.mean()).isEqualTo(67.26);
        assertThat(serumTrp.standardDeviation()).isEqualTo(11.19);
        assertThat(serumTrp.unit()).isEqualTo("μM");

        NormativeReference plasmaKyn = referenceData.norm(Metabolite.KYN, SampleType.PLASMA, NormPopulation.GLOBAL);
        assertThat(plasmaKyn.mean()).isEqualTo(1.82);
        assertThat(plasmaKyn.standardDeviation()).isEqualTo(0.54);
        assertThat(plasmaKyn.label()).isEqualTo("Plasma Kynurenine");
    }

    @Test
    void loadsAgeAndSexEffects() {
        assertThat(referenceData.ageEffect(Metabolite.TRP, SampleType.PLASMA).beta()).isEqualTo(-0.74);
        assertThat(referenceData.ageEffect(Metabolite.KYN, SampleType.SERUM).pValue()).isCloseTo(0.002, within(1e-12));

        assertThat(referenceData.sexEffect(Metabolite.TRP, SampleType.SERUM))
                .hasValueSatisfying(effect -> assertThat(effect.beta()).isEqualTo(-0.22));
        assertThat(referenceData.sexEffect(Metabolite.TRP, SampleType.PLASMA)).isEmpty();
    }

    @Test
    void treatmentsAreInTableOrder() {
        assertThat(referenceData.treatments())
                .extracting(TreatmentOption::treatment)
                .containsExactly(Treatment.ITBS, Treatment.MHT, Treatment.SSRI_SNRI, Treatment.CBT, Treatment.MONITORING);
    }

    @Test
    void treatmentCostsAndEvidence() {
        TreatmentOption itbs = referenceData.treatment(Treatment.ITBS);
        assertThat(itbs.annualCost()).isEqualTo(7500);
        assertThat(itbs.rebate()).isEqualTo(4080);
        assertThat(itbs.outOfPocket()).isEqualTo(3420);
        assertThat(itbs.cognitionEvidence()).isEqualTo(EvidenceGrade.GAP);

        TreatmentOption cbt = referenceData.treatment(Treatment.CBT);
        assertThat(cbt.outOfPocket()).isZero();
        assertThat(cbt.evidenceProfile()).isEqualTo(new EvidenceProfile(8, 4, 6, 8, 7, 10));
    }

    @Test
    void conditionsOrderedByBurden() {
        assertThat(referenceData.conditions()).hasSize(6);
        assertThat(referenceData.conditions().get(0).name()).isEqualTo("Alzheimer's/Dementia");
        assertThat(referenceData.conditions().get(0).annualBurdenBillions()).isEqualTo(18.0);
    }

    @Test
    void missingResource_failsAtStartup() {
        RdfService rdf = new RdfService(new ClassPathResource("rdf/does-not-exist.ttl"));

        assertThatThrownBy(rdf::loadRdfOnStartup)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to load RDF file");
    }
}
