package com.coherenceai.infrastructure.persistence;

import com.coherenceai.domain.analysis.model.Concept;
import com.coherenceai.domain.analysis.model.Relationship;

import java.util.List;

/**
 * The writes derived from one request, with the number of attempts made so far.
 * Concepts are written before relationships because relationships reference stored concepts.
 */
public record PendingKnowledgeWrite(
        List<Concept> concepts,
        List<RelationshipWrite> relationships,
        int attempts
) {
    public PendingKnowledgeWrite {
        concepts = List.copyOf(concepts);
        relationships = List.copyOf(relationships);
    }

    public record RelationshipWrite(Relationship relationship, double strengthDelta) {}

    public boolean isEmpty() {
        return concepts.isEmpty() && relationships.isEmpty();
    }

    public int size() {
        return concepts.size() + relationships.size();
    }

    /**
     * The part that still has to be written after a failure, with one more attempt counted.
     */
    public PendingKnowledgeWrite remaining(List<Concept> failedConcepts, List<RelationshipWrite> failedRelationships) {
        return new PendingKnowledgeWrite(failedConcepts, failedRelationships, attempts + 1);
    }
}
