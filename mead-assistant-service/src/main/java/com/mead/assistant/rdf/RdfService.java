package com.mead.assistant.rdf;

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

    private final Resource knowledgeFile;

    // Loaded once under a write transaction; the repository reads it under read transactions.
    @Getter
    private final Dataset dataset = DatasetFactory.createTxnMem();

    public RdfService(@Value("${mead.knowledge.data-file}") Resource knowledgeFile) {
        this.knowledgeFile = knowledgeFile;
    }

    @PostConstruct
    public void loadRdfOnStartup() {
        try (InputStream in = knowledgeFile.getInputStream()) {
            Txn.executeWrite(dataset, () -> RDFDataMgr.read(dataset.getDefaultModel(), in, Lang.TURTLE));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load knowledge file: " + knowledgeFile, e);
        }
        log.info("Loaded knowledge graph from {}", knowledgeFile.getDescription());
    }
}
