package com.mead.assistant.rdf;

import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.ResourceFactory;

/**
 * Terms of the knowledge graph: schema.org for identity, the mead vocabulary for the rest.
 */
public final class MeadVocabulary {

    public static final String SCHEMA = "https://schema.org/";
    public static final String MEAD = "https://mead.example/vocab#";

    public static final Property IDENTIFIER = schema("identifier");
    public static final Property NAME = schema("name");
    public static final Property CODE = schema("code");

    public static final Resource CONDITION = type("Condition");
    public static final Resource DRUG = type("Drug");
    public static final Resource SYMPTOM = type("Symptom");
    public static final Resource INTERACTION = type("Interaction");
    public static final Resource DRUG_CLASS = type("DrugClass");
    public static final Resource EMERGENCY_CONDITION_LIST = type("EmergencyConditionList");

    // Condition
    public static final Property SEVERITY = mead("severity");
    public static final Property PREVALENCE = mead("prevalence");
    public static final Property EVIDENCE_LEVEL = mead("evidenceLevel");
    public static final Property SYMPTOMS = mead("symptoms");
    public static final Property CAUSES = mead("causes");
    public static final Property TREATMENTS = mead("treatments");
    public static final Property COMPLICATIONS = mead("complications");
    public static final Property PREVENTION = mead("prevention");
    public static final Property RISK_FACTORS = mead("riskFactors");
    public static final Property DIAGNOSTIC_TESTS = mead("diagnosticTests");
    public static final Property AGE_GROUPS = mead("ageGroups");
    public static final Property SPECIALTIES = mead("specialties");

    // Drug
    public static final Property GENERIC_NAME = mead("genericName");
    public static final Property DRUG_CLASS_NAME = mead("drugClass");
    public static final Property DOSAGE = mead("dosage");
    public static final Property PREGNANCY_CATEGORY = mead("pregnancyCategory");
    public static final Property INDICATIONS = mead("indications");
    public static final Property CONTRAINDICATIONS = mead("contraindications");
    public static final Property SIDE_EFFECTS = mead("sideEffects");
    public static final Property INTERACTIONS = mead("interactions");
    public static final Property MONITORING = mead("monitoring");

    // Symptom
    public static final Property POSSIBLE_CONDITIONS = mead("possibleConditions");
    public static final Property SEVERITY_INDICATORS = mead("severityIndicators");
    public static final Property SEEK_HELP = mead("seekHelp");
    public static final Property SELF_CARE = mead("selfCare");

    // Interaction, drug class, emergency list
    public static final Property PRIMARY_DRUG = mead("primaryDrug");
    public static final Property PARTNER_DRUG = mead("partnerDrug");
    public static final Property INTERACTION_SEVERITY = mead("interactionSeverity");
    public static final Property MECHANISM = mead("mechanism");
    public static final Property MANAGEMENT = mead("management");
    public static final Property MEMBERS = mead("members");
    public static final Property CONDITION_NAMES = mead("conditionNames");

    private static Property schema(String localName) {
        return ResourceFactory.createProperty(SCHEMA, localName);
    }

    private static Property mead(String localName) {
        return ResourceFactory.createProperty(MEAD, localName);
    }

    private static Resource type(String localName) {
        return ResourceFactory.createResource(MEAD + localName);
    }

    private MeadVocabulary() {}
}
