package com.coherenceai.domain.knowledge.repository;

import com.coherenceai.domain.knowledge.model.RelationshipRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RelationshipRecordRepository extends JpaRepository<RelationshipRecord, Long> {

    Optional<RelationshipRecord> findBySubjectIdAndPredicateLemmaAndObjectIdAndDependencyType(
            Long subjectId, String predicateLemma, Long objectId, String dependencyType);
}
