package com.mead.assistant.repository;

import com.mead.assistant.knowledge.Condition;
import com.mead.assistant.knowledge.Drug;
import com.mead.assistant.knowledge.EvidenceLevel;
import com.mead.assistant.knowledge.InteractionRecord;
import com.mead.assistant.knowledge.InteractionSeverity;
import com.mead.assistant.knowledge.KnowledgeBase;
import com.mead.assistant.knowledge.Severity;
import com.mead.assistant.rdf.RdfService;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class KnowledgeBaseRepositoryTest {

    private static KnowledgeBase knowledgeBase;

    @BeforeAll
    static void load() {
        RdfService rdf = new RdfService(new ClassPathResource("rdf/knowledge-base.ttl"));
        rdf.loadRdfOnStartup();
        knowledgeBase = new KnowledgeBaseRepository(rdf).load();
    }

    @Test
    void seedData_hasExpectedCounts() {
        assertThat(knowledgeBase.getConditions()).hasSize(15);
        assertThat(knowledgeBase.getDrugs()).hasSize(3);
        assertThat(knowledgeBase.getSymptoms()).hasSize(3);
        assertThat(knowledgeBase.getEmergencyConditionNames()).hasSize(12);
        assertThat(knowledgeBase.interactionCount()).isEqualTo(5);
        assertThat(knowledgeBase.getDrugClasses()).hasSize(4);
    }

    @Test
    void entities_areInsertedInIdentifierOrder() {
        assertThat(knowledgeBase.getConditions().keySet()).first().isEqualTo("anxiety_disorder");
        assertThat(knowledgeBase.getDrugs().keySet()).containsExactly("lisinopril", "metformin", "warfarin");
        assertThat(knowledgeBase.getSymptoms().keySet()).containsExactly("chest_pain", "fever", "headache");
    }

    @Test
    void condition_keepsListOrderAndScalars() {
        Condition diabetes = knowledgeBase.findCondition("diabetes_type2").orElseThrow();

        assertThat(diabetes.name()).isEqualTo("Type 2 Diabetes Mellitus");
        assertThat(diabetes.classificationCode()).isEqualTo("E11");
        assertThat(diabetes.severity()).isEqualTo(Severity.HIGH);
        assertThat(diabetes.evidenceLevel()).isEqualTo(EvidenceLevel.LEVEL_1A);
        assertThat(diabetes.treatments()).startsWith("Metformin", "Insulin");
        assertThat(diabetes.prevention())
                .containsExactly("Healthy diet", "Regular exercise", "Weight management", "Regular screening");
    }

    @Test
    void conditionWithoutEvidenceLevel_defaultsToExpertOpinion() {
        Condition copd = knowledgeBase.findCondition("copd").orElseThrow();

        assertThat(copd.evidenceLevel()).isEqualTo(EvidenceLevel.EXPERT_OPINION);
    }

    @Test
    void drug_isMappedFromGraph() {
        Drug metformin = knowledgeBase.findDrug("metformin").orElseThrow();

        assertThat(metformin.name()).isEqualTo("Metformin");
        assertThat(metformin.indications()).contains("Type 2 diabetes");
    }

    @Test
    void interactions_areGroupedByPrimaryDrug() {
        assertThat(knowledgeBase.getInteractionTable()).containsOnlyKeys("Metformin", "Warfarin");
        assertThat(knowledgeBase.getInteractionTable().get("Warfarin"))
                .extracting(InteractionRecord::partnerDrug)
                .containsExactly("Antibiotics", "Antifungals", "NSAIDs");
        assertThat(knowledgeBase.getInteractionTable().get("Warfarin"))
                .filteredOn(r -> r.partnerDrug().equals("NSAIDs"))
                .extracting(InteractionRecord::severity)
                .containsExactly(InteractionSeverity.MAJOR);
    }

    @Test
    void drugClasses_listTheirMembers() {
        assertThat(knowledgeBase.getDrugClasses().get("NSAIDs")).contains("Ibuprofen", "Naproxen", "Aspirin");
    }

    @Test
    void emptyGraph_yieldsEmptyKnowledgeBase() {
        RdfService rdf = new RdfService(new ByteArrayResource(
                "@prefix schema: <https://schema.org/> .".getBytes(StandardCharsets.UTF_8)));
        rdf.loadRdfOnStartup();

        KnowledgeBase empty = new KnowledgeBaseRepository(rdf).load();

        assertThat(empty.getConditions()).isEmpty();
        assertThat(empty.interactionCount()).isZero();
    }

    @Test
    void missingDataFile_failsStartup() {
        RdfService rdf = new RdfService(new ClassPathResource("rdf/does-not-exist.ttl"));

        assertThatThrownBy(rdf::loadRdfOnStartup).isInstanceOf(IllegalStateException.class);
    }
}
