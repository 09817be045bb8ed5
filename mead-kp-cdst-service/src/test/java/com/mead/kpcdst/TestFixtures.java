package com.mead.kpcdst;

import com.mead.kpcdst.config.CostModelProperties;
import com.mead.kpcdst.config.DementiaCostProperties;
import com.mead.kpcdst.model.ReferenceData;
import com.mead.kpcdst.rdf.RdfService;
import com.mead.kpcdst.repository.ReferenceDataRepository;
import org.springframework.core.io.ClassPathResource;

public final class TestFixtures {

    public static final String REFERENCE_DATA = "rdf/kp-reference-data.ttl";

    private static ReferenceData referenceData;

    public static synchronized ReferenceData referenceData() {
        if (referenceData == null) {
            RdfService rdf = new RdfService(new ClassPathResource(REFERENCE_DATA));
            rdf.loadRdfOnStartup();
            referenceData = new ReferenceDataRepository(rdf).load();
        }
        return referenceData;
    }

    public static CostModelProperties costModel() {
        return costModel(new CostModelProperties.Efficacy(0.22, 0.12, 0.15, 0.10, 0.08, 0.03));
    }

    public static CostModelProperties costModel(CostModelProperties.Efficacy efficacy) {
        return new CostModelProperties(
                25_917,
                360_000,
                0.02,
                0.005,
                0.10,
                efficacy,
                new CostModelProperties.ProductivityComponents(196, 190, 13_166, 7_110, 5_256)
        );
    }

    public static DementiaCostProperties dementiaCost() {
        return new DementiaCostProperties(
                442_000,
                2_500_000,
                0.03,
                50_000,
                50_000,
                new DementiaCostProperties.SubgroupFractions(0.20, 0.12, 0.05)
        );
    }

    private TestFixtures() {}
}
