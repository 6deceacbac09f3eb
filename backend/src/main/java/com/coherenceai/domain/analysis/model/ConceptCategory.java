package com.coherenceai.domain.analysis.model;

import java.util.Locale;

/**
 * Conceptual category of an entity label, used when an entity is stored as a concept.
 */
public enum ConceptCategory {
    AGENT, ORGANIZATION, LOCATION, TEMPORAL, VALUE, ARTIFACT, EVENT, CONCEPT, GROUP, GENERAL;

    public static ConceptCategory fromEntityLabel(String label) {
        if (label == null) {
            return GENERAL;
        }
        return switch (label.toUpperCase(Locale.ROOT)) {
            case "PERSON" -> AGENT;
            case "ORG" -> ORGANIZATION;
            case "GPE", "LOC" -> LOCATION;
            case "DATE", "TIME" -> TEMPORAL;
            case "MONEY", "PERCENT" -> VALUE;
            case "PRODUCT", "WORK_OF_ART" -> ARTIFACT;
            case "EVENT" -> EVENT;
            case "LAW", "LANGUAGE" -> CONCEPT;
            case "NORP" -> GROUP;
            default -> GENERAL;
        };
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
