package com.coherenceai.infrastructure.persistence;

import com.coherenceai.domain.analysis.model.Concept;
import com.coherenceai.domain.analysis.model.Relationship;
import com.coherenceai.domain.knowledge.model.RelationshipRecord;
import com.coherenceai.domain.knowledge.repository.RelationshipRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
@Import(JpaKnowledgeStore.class)
class JpaKnowledgeStoreTest {

    @Autowired
    private JpaKnowledgeStore store;

    @Autowired
    private RelationshipRecordRepository relationshipRepository;

    private static Concept concept(String name) {
        return new Concept(name, name, "CONCEPT", "NOUN", "general");
    }

    @Nested
    @DisplayName("Concepts")
    class ConceptTests {
        @Test
        void new_concept_starts_at_frequency_one() {
            Concept stored = store.upsertConcept(concept("respect"));

            assertThat(stored.frequency()).isEqualTo(1);
            assertThat(store.countConcepts()).isEqualTo(1);
        }

        @Test
        void repeated_concept_increments_frequency() {
            store.upsertConcept(concept("respect"));
            store.upsertConcept(concept("respect"));
            Concept third = store.upsertConcept(concept("respect"));

            assertThat(third.frequency()).isEqualTo(3);
            assertThat(store.countConcepts()).isEqualTo(1);
        }

        @Test
        void same_name_with_other_entity_type_is_a_separate_concept() {
            store.upsertConcept(concept("Paris"));
            store.upsertConcept(new Concept("Paris", "Paris", "GPE", "PROPN", "location"));

            assertThat(store.countConcepts()).isEqualTo(2);
        }

        @Test
        void top_concepts_are_ordered_by_frequency() {
            store.upsertConcept(concept("team"));
            store.upsertConcept(concept("respect"));
            store.upsertConcept(concept("respect"));
            store.upsertConcept(concept("fairness"));
            store.upsertConcept(concept("fairness"));
            store.upsertConcept(concept("fairness"));

            List<Concept> top = store.topConcepts(2);

            assertThat(top).extracting(Concept::name).containsExactly("fairness", "respect");
            assertThat(top).extracting(Concept::frequency).containsExactly(3, 2);
            assertThat(store.topConcepts(0)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Relationships")
    class RelationshipTests {
        private final Relationship teamValuesRespect =
                new Relationship("team", "values", "value", "respect", "nsubj-dobj", "VBZ");

        @Test
        void relationship_without_stored_endpoints_is_skipped() {
            store.upsertConcept(concept("team"));

            assertThat(store.upsertRelationship(teamValuesRespect, 1.0)).isFalse();
            assertThat(relationshipRepository.count()).isZero();
        }

        @Test
        void repeated_relationship_accumulates_strength() {
            store.upsertConcept(concept("team"));
            store.upsertConcept(concept("respect"));

            assertThat(store.upsertRelationship(teamValuesRespect, 1.0)).isTrue();
            assertThat(store.upsertRelationship(teamValuesRespect, 0.5)).isTrue();

            List<RelationshipRecord> records = relationshipRepository.findAll();
            assertThat(records).hasSize(1);
            assertThat(records.get(0).getStrength()).isCloseTo(1.5, within(1e-9));
            assertThat(records.get(0).getPredicateLemma()).isEqualTo("value");
        }
    }
}
