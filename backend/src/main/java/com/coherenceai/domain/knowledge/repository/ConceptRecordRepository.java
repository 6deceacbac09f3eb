package com.coherenceai.domain.knowledge.repository;

import com.coherenceai.domain.knowledge.model.ConceptRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ConceptRecordRepository extends JpaRepository<ConceptRecord, Long> {

    Optional<ConceptRecord> findByNameAndEntityType(String name, String entityType);

    Optional<ConceptRecord> findFirstByNameOrderByFrequencyDescIdAsc(String name);

    List<ConceptRecord> findAllByOrderByFrequencyDescIdAsc(Pageable pageable);
}
