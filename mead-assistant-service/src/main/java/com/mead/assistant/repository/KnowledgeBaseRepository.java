package com.mead.assistant.repository;

import com.mead.assistant.knowledge.Condition;
import com.mead.assistant.knowledge.Drug;
import com.mead.assistant.knowledge.EvidenceLevel;
import com.mead.assistant.knowledge.InteractionRecord;
import com.mead.assistant.knowledge.InteractionSeverity;
import com.mead.assistant.knowledge.KnowledgeBase;
import com.mead.assistant.knowledge.Severity;
import com.mead.assistant.knowledge.Symptom;
import com.mead.assistant.rdf.RdfService;
import org.apache.jena.query.*;
import org.apache.jena.rdf.model.*;
import org.apache.jena.system.Txn;
import org.apache.jena.vocabulary.RDF;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.mead.assistant.rdf.MeadVocabulary.*;

/**
 * Reads the knowledge graph into an immutable {@link KnowledgeBase}.
 * <p>
 * Entities are enumerated in identifier order, which becomes the knowledge base insertion order.
 * List-valued fields are RDF collections so their order survives the round trip.
 */
@Component
public class KnowledgeBaseRepository {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseRepository.class);

    private static final String ENTITIES_OF_TYPE = """
            PREFIX schema: <https://schema.org/>
            SELECT ?entity ?identifier WHERE {
              ?entity a ?type ;
                      schema:identifier ?identifier .
            }
            ORDER BY ?identifier
            """;

    private final RdfService rdf;

    public KnowledgeBaseRepository(RdfService rdf) {
        this.rdf = rdf;
    }

    public KnowledgeBase load() {
        KnowledgeBase knowledgeBase = Txn.calculateRead(rdf.getDataset(), () -> {
            Model model = rdf.getDataset().getDefaultModel();
            KnowledgeBase.Builder builder = KnowledgeBase.builder();

            for (Resource resource : entitiesOfType(model, CONDITION)) {
                builder.condition(toCondition(resource));
            }
            for (Resource resource : entitiesOfType(model, DRUG)) {
                builder.drug(toDrug(resource));
            }
            for (Resource resource : entitiesOfType(model, SYMPTOM)) {
                builder.symptom(toSymptom(resource));
            }
            for (Resource resource : entitiesOfType(model, INTERACTION)) {
                builder.interaction(toInteraction(resource));
            }
            for (Resource resource : entitiesOfType(model, DRUG_CLASS)) {
                builder.drugClass(text(resource, NAME), list(resource, MEMBERS));
            }
            ResIterator lists = model.listResourcesWithProperty(RDF.type, EMERGENCY_CONDITION_LIST);
            try {
                while (lists.hasNext()) {
                    builder.emergencyConditionNames(list(lists.next(), CONDITION_NAMES));
                }
            } finally {
                lists.close();
            }
            return builder.build();
        });

        log.info("Knowledge base ready: {} conditions, {} drugs, {} symptoms, {} interactions, {} emergency conditions",
                knowledgeBase.getConditions().size(),
                knowledgeBase.getDrugs().size(),
                knowledgeBase.getSymptoms().size(),
                knowledgeBase.interactionCount(),
                knowledgeBase.getEmergencyConditionNames().size());
        return knowledgeBase;
    }

    private List<Resource> entitiesOfType(Model model, Resource type) {
        ParameterizedSparqlString sparql = new ParameterizedSparqlString(ENTITIES_OF_TYPE);
        sparql.setIri("type", type.getURI());

        List<Resource> entities = new ArrayList<>();
        try (QueryExecution queryExecution = QueryExecutionFactory.create(sparql.asQuery(), rdf.getDataset())) {
            ResultSet resultSet = queryExecution.execSelect();
            while (resultSet.hasNext()) {
                QuerySolution row = resultSet.next();
                RDFNode entityNode = row.get("entity");
                entities.add(entityNode.isURIResource()
                        ? model.getResource(entityNode.asResource().getURI())
                        : entityNode.asResource().inModel(model));
            }
        }
        return entities;
    }

    private static Condition toCondition(Resource resource) {
        return Condition.builder()
                .identifier(text(resource, IDENTIFIER))
                .name(text(resource, NAME))
                .classificationCode(text(resource, CODE))
                .severity(severity(text(resource, SEVERITY)))
                .prevalence(text(resource, PREVALENCE))
                .evidenceLevel(EvidenceLevel.fromCode(text(resource, EVIDENCE_LEVEL)))
                .symptoms(list(resource, SYMPTOMS))
                .causes(list(resource, CAUSES))
                .treatments(list(resource, TREATMENTS))
                .complications(list(resource, COMPLICATIONS))
                .prevention(list(resource, PREVENTION))
                .riskFactors(list(resource, RISK_FACTORS))
                .diagnosticTests(list(resource, DIAGNOSTIC_TESTS))
                .ageGroups(list(resource, AGE_GROUPS))
                .specialties(list(resource, SPECIALTIES))
                .build();
    }

    private static Drug toDrug(Resource resource) {
        return Drug.builder()
                .identifier(text(resource, IDENTIFIER))
                .name(text(resource, NAME))
                .genericName(text(resource, GENERIC_NAME))
                .drugClass(text(resource, DRUG_CLASS_NAME))
                .dosage(text(resource, DOSAGE))
                .pregnancyCategory(text(resource, PREGNANCY_CATEGORY))
                .indications(list(resource, INDICATIONS))
                .contraindications(list(resource, CONTRAINDICATIONS))
                .sideEffects(list(resource, SIDE_EFFECTS))
                .interactions(list(resource, INTERACTIONS))
                .monitoring(list(resource, MONITORING))
                .build();
    }

    private static Symptom toSymptom(Resource resource) {
        return Symptom.builder()
                .identifier(text(resource, IDENTIFIER))
                .name(text(resource, NAME))
                .possibleConditions(list(resource, POSSIBLE_CONDITIONS))
                .severityIndicators(list(resource, SEVERITY_INDICATORS))
                .seekHelp(list(resource, SEEK_HELP))
                .selfCare(list(resource, SELF_CARE))
                .build();
    }

    private static InteractionRecord toInteraction(Resource resource) {
        return new InteractionRecord(
                text(resource, PRIMARY_DRUG),
                text(resource, PARTNER_DRUG),
                InteractionSeverity.fromLabel(text(resource, INTERACTION_SEVERITY)),
                text(resource, MECHANISM),
                text(resource, MANAGEMENT)
        );
    }

    private static Severity severity(String label) {
        return label.isEmpty() ? null : Severity.fromLabel(label);
    }

    private static String text(Resource resource, Property property) {
        Statement statement = resource.getProperty(property);
        if (statement == null || !statement.getObject().isLiteral()) return "";
        return statement.getString().trim();
    }

    private static List<String> list(Resource resource, Property property) {
        Resource head = resource.getPropertyResourceValue(property);
        if (head == null) return List.of();
        List<String> values = new ArrayList<>();
        for (RDFNode node : head.as(RDFList.class).asJavaList()) {
            if (node.isLiteral()) {
                values.add(node.asLiteral().getString().trim());
            }
        }
        return values;
    }
}
