package com.coherenceai.domain.knowledge.service;

import com.coherenceai.domain.analysis.model.Concept;
import com.coherenceai.domain.analysis.model.Relationship;

import java.util.List;

/**
 * Durable store of deduplicated concepts and relationships with frequency counters.
 * Implementations throw {@code PersistenceUnavailableException} when the backing store cannot be reached.
 */
public interface KnowledgeStore {

    /**
     * Insert the concept with frequency 1, or increment the frequency of the concept
     * already stored under the same {@code (name, entityType)} key.
     *
     * @return the stored concept after the update
     */
    Concept upsertConcept(Concept concept);

    /**
     * Store the relationship between two known concepts. A relationship already stored for the same
     * subject, predicate lemma, object and dependency type is strengthened by {@code strengthDelta};
     * a new one starts at {@code strengthDelta}.
     *
     * @return false if subject or object is not a stored concept (nothing written)
     */
    boolean upsertRelationship(Relationship relationship, double strengthDelta);

    long countConcepts();

    /**
     * Most frequent concepts first.
     */
    List<Concept> topConcepts(int limit);
}
