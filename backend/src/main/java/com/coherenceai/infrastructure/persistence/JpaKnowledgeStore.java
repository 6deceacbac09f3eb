package com.coherenceai.infrastructure.persistence;

import com.coherenceai.domain.analysis.model.Concept;
import com.coherenceai.domain.analysis.model.Relationship;
import com.coherenceai.domain.knowledge.model.ConceptRecord;
import com.coherenceai.domain.knowledge.model.RelationshipRecord;
import com.coherenceai.domain.knowledge.repository.ConceptRecordRepository;
import com.coherenceai.domain.knowledge.repository.RelationshipRecordRepository;
import com.coherenceai.domain.knowledge.service.KnowledgeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaKnowledgeStore implements KnowledgeStore {

    private final ConceptRecordRepository conceptRepository;
    private final RelationshipRecordRepository relationshipRepository;

    @Override
    @Transactional
    public Concept upsertConcept(Concept concept) {
        try {
            String entityType = concept.entityType() != null ? concept.entityType() : "unknown";
            ConceptRecord record = conceptRepository.findByNameAndEntityType(concept.name(), entityType)
                    .map(existing -> {
                        existing.recordSighting();
                        return existing;
                    })
                    .orElseGet(() -> conceptRepository.save(new ConceptRecord(concept)));
            return record.toConcept();
        } catch (DataAccessException e) {
            throw new PersistenceUnavailableException("Failed to upsert concept '" + concept.name() + "'", e);
        }
    }

    @Override
    @Transactional
    public boolean upsertRelationship(Relationship relationship, double strengthDelta) {
        try {
            Optional<ConceptRecord> subject = conceptRepository.findFirstByNameOrderByFrequencyDescIdAsc(relationship.subject());
            Optional<ConceptRecord> object = conceptRepository.findFirstByNameOrderByFrequencyDescIdAsc(relationship.object());
            if (subject.isEmpty() || object.isEmpty()) {
                log.debug("Skipping relationship '{}' -[{}]-> '{}': endpoint concept not stored",
                        relationship.subject(), relationship.predicateLemma(), relationship.object());
                return false;
            }

            RelationshipRecord candidate = new RelationshipRecord(
                    subject.get().getId(), relationship, object.get().getId(), strengthDelta);
            relationshipRepository.findBySubjectIdAndPredicateLemmaAndObjectIdAndDependencyType(
                            candidate.getSubjectId(), candidate.getPredicateLemma(),
                            candidate.getObjectId(), candidate.getDependencyType())
                    .ifPresentOrElse(
                            existing -> existing.strengthen(strengthDelta),
                            () -> relationshipRepository.save(candidate));
            return true;
        } catch (DataAccessException e) {
            throw new PersistenceUnavailableException(
                    "Failed to upsert relationship '" + relationship.subject() + "' -> '" + relationship.object() + "'", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countConcepts() {
        try {
            return conceptRepository.count();
        } catch (DataAccessException e) {
            throw new PersistenceUnavailableException("Failed to count concepts", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Concept> topConcepts(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        try {
            return conceptRepository.findAllByOrderByFrequencyDescIdAsc(PageRequest.of(0, limit)).stream()
                    .map(ConceptRecord::toConcept)
                    .toList();
        } catch (DataAccessException e) {
            throw new PersistenceUnavailableException("Failed to read top concepts", e);
        }
    }
}
