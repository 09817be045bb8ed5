package com.mead.kpcdst.repository;

import com.mead.kpcdst.model.EvidenceGrade;
import com.mead.kpcdst.model.KpLinkedCondition;
import com.mead.kpcdst.model.Metabolite;
import com.mead.kpcdst.model.NormPopulation;
import com.mead.kpcdst.model.NormativeReference;
import com.mead.kpcdst.model.ReferenceData;
import com.mead.kpcdst.model.RegressionCoefficient;
import com.mead.kpcdst.model.SampleType;
import com.mead.kpcdst.model.Treatment;
import com.mead.kpcdst.model.TreatmentOption;
import com.mead.kpcdst.model.TreatmentOption.EvidenceProfile;
import com.mead.kpcdst.rdf.RdfService;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionFactory;
import org.apache.jena.query.QuerySolution;
import org.apache.jena.query.ResultSet;
import org.apache.jena.system.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Reads the reference tables out of the RDF dataset and materializes them as immutable records.
 */
@Component
public class ReferenceDataRepository {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataRepository.class);

    private static final String PREFIXES = """
            PREFIX schema: <https://schema.org/>
            PREFIX kp: <https://mead.example/kp#>
            """;

    private final RdfService rdf;

    public ReferenceDataRepository(RdfService rdf) {
        this.rdf = rdf;
    }

    public ReferenceData load() {
        return Txn.calculateRead(rdf.getDataset(), () -> {
            List<NormativeReference> norms = fetchNorms();
            List<RegressionCoefficient> ageEffects = fetchCoefficients("kp:AgeEffect");
            List<RegressionCoefficient> sexEffects = fetchCoefficients("kp:SexEffect");
            List<TreatmentOption> treatments = fetchTreatments();
            List<KpLinkedCondition> conditions = fetchConditions();

            log.info("Reference data: {} norms, {} age effects, {} sex effects, {} treatments, {} conditions",
                    norms.size(), ageEffects.size(), sexEffects.size(), treatments.size(), conditions.size());

            return new ReferenceData(norms, ageEffects, sexEffects, treatments, conditions);
        });
    }

    private List<NormativeReference> fetchNorms() {
        String sparqlQuery = PREFIXES + """
                SELECT ?name ?metabolite ?sampleType ?population ?mean ?sd ?unit WHERE {
                  ?norm a kp:NormativeReference ;
                        schema:name ?name ;
                        kp:metabolite ?metabolite ;
                        kp:sampleType ?sampleType ;
                        kp:population ?population ;
                        kp:mean ?mean ;
                        kp:standardDeviation ?sd ;
                        schema:unitText ?unit .
                }
                ORDER BY ?population ?sampleType ?metabolite
                """;

        return select(sparqlQuery, row -> new NormativeReference(
                Metabolite.fromLabel(row.getLiteral("metabolite").getString()),
                SampleType.fromLabel(row.getLiteral("sampleType").getString()),
                NormPopulation.fromLabel(row.getLiteral("population").getString()),
                row.getLiteral("mean").getDouble(),
                row.getLiteral("sd").getDouble(),
                row.getLiteral("unit").getString(),
                row.getLiteral("name").getString()
        ));
    }

    private List<RegressionCoefficient> fetchCoefficients(String type) {
        String sparqlQuery = PREFIXES + """
                SELECT ?metabolite ?sampleType ?beta ?p WHERE {
                  ?effect a %s ;
                          kp:metabolite ?metabolite ;
                          kp:sampleType ?sampleType ;
                          kp:beta ?beta ;
                          kp:pValue ?p .
                }
                ORDER BY ?sampleType ?metabolite
                """.formatted(type);

        return select(sparqlQuery, row -> new RegressionCoefficient(
                Metabolite.fromLabel(row.getLiteral("metabolite").getString()),
                SampleType.fromLabel(row.getLiteral("sampleType").getString()),
                row.getLiteral("beta").getDouble(),
                row.getLiteral("p").getDouble()
        ));
    }

    private List<TreatmentOption> fetchTreatments() {
        String sparqlQuery = PREFIXES + """
                SELECT ?identifier ?name ?description ?cost ?rebate ?oop ?mood ?cognition
                       ?moodScore ?cognitionScore ?vmsScore ?costScore ?accessScore ?safetyScore WHERE {
                  ?treatment a kp:TreatmentOption ;
                             schema:identifier ?identifier ;
                             schema:name ?name ;
                             schema:description ?description ;
                             kp:annualCost ?cost ;
                             kp:rebate ?rebate ;
                             kp:outOfPocket ?oop ;
                             kp:moodEvidence ?mood ;
                             kp:cognitionEvidence ?cognition ;
                             kp:moodScore ?moodScore ;
                             kp:cognitionScore ?cognitionScore ;
                             kp:vasomotorScore ?vmsScore ;
                             kp:costEffectivenessScore ?costScore ;
                             kp:accessScore ?accessScore ;
                             kp:safetyScore ?safetyScore .
                }
                """;

        return select(sparqlQuery, row -> new TreatmentOption(
                Treatment.fromLabel(row.getLiteral("identifier").getString()),
                row.getLiteral("name").getString(),
                row.getLiteral("cost").getLong(),
                row.getLiteral("rebate").getLong(),
                row.getLiteral("oop").getLong(),
                EvidenceGrade.fromLabel(row.getLiteral("mood").getString()),
                EvidenceGrade.fromLabel(row.getLiteral("cognition").getString()),
                row.getLiteral("description").getString(),
                new EvidenceProfile(
                        row.getLiteral("moodScore").getInt(),
                        row.getLiteral("cognitionScore").getInt(),
                        row.getLiteral("vmsScore").getInt(),
                        row.getLiteral("costScore").getInt(),
                        row.getLiteral("accessScore").getInt(),
                        row.getLiteral("safetyScore").getInt()
                )
        ));
    }

    private List<KpLinkedCondition> fetchConditions() {
        String sparqlQuery = PREFIXES + """
                SELECT ?name ?burden ?link ?hr ?evidence WHERE {
                  ?condition a kp:KpLinkedCondition ;
                             schema:name ?name ;
                             kp:burdenBillions ?burden ;
                             kp:kpLink ?link ;
                             kp:riskHazardRatio ?hr ;
                             kp:evidence ?evidence .
                }
                ORDER BY DESC(?burden)
                """;

        return select(sparqlQuery, row -> new KpLinkedCondition(
                row.getLiteral("name").getString(),
                row.getLiteral("burden").getDouble(),
                row.getLiteral("link").getString(),
                row.getLiteral("hr").getDouble(),
                EvidenceGrade.fromLabel(row.getLiteral("evidence").getString())
        ));
    }

    private <T> List<T> select(String sparqlQuery, Function<QuerySolution, T> mapper) {
        List<T> rows = new ArrayList<>();
        try (QueryExecution queryExecution = QueryExecutionFactory.create(sparqlQuery, rdf.getDataset())) {
            ResultSet resultSet = queryExecution.execSelect();
            while (resultSet.hasNext()) {
                rows.add(mapper.apply(resultSet.next()));
            }
        }
        return rows;
    }
}
