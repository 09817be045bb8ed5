package com.mead.kpcdst.rdf;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.DatasetFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.system.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.InputStream;

@Service
public class RdfService {

    private static final Logger log = LoggerFactory.getLogger(RdfService.class);

    private final Resource rdfFile;

    // Dataset (instead of plain Model) lets us use safe read/write transactions.
    @Getter
    private final Dataset dataset = DatasetFactory.createTxnMem();

    public RdfService(@Value("${mead.rdf.data-file}") Resource rdfFile) {
        this.rdfFile = rdfFile;
    }

    @PostConstruct
    public void loadRdfOnStartup() {
        try (InputStream in = rdfFile.getInputStream()) {
            Txn.executeWrite(dataset, () -> {
                // Load into the default graph of this dataset.
                RDFDataMgr.read(dataset.getDefaultModel(), in, Lang.TURTLE);
            });
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load RDF file: " + rdfFile, e);
        }
        log.info("Loaded reference data from {} ({} triples)", rdfFile.getDescription(),
                Txn.calculateRead(dataset, () -> dataset.getDefaultModel().size()));
    }
}
