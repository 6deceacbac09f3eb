package com.coherenceai.domain.knowledge.model;

import com.coherenceai.domain.analysis.model.Relationship;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A stored relation between two concept rows, referenced by id.
 */
@Entity
@Table(name = "relationships")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RelationshipRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "subject_id", nullable = false)
    private Long subjectId;

    @Column(length = 128)
    private String predicate;

    @Column(name = "predicate_lemma", length = 128)
    private String predicateLemma;

    @Column(name = "object_id", nullable = false)
    private Long objectId;

    @Column(name = "dependency_type", length = 64)
    private String dependencyType;

    @Column(name = "verb_tense", length = 16)
    private String verbTense;

    @Column(nullable = false)
    private double strength;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public RelationshipRecord(Long subjectId, Relationship relationship, Long objectId, double initialStrength) {
        this.subjectId = subjectId;
        this.predicate = relationship.predicate();
        this.predicateLemma = relationship.predicateLemma() != null
                ? relationship.predicateLemma()
                : relationship.predicate();
        this.objectId = objectId;
        this.dependencyType = relationship.dependencyType() != null ? relationship.dependencyType() : "unknown";
        this.verbTense = relationship.verbTense();
        this.strength = initialStrength;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    public void strengthen(double delta) {
        this.strength += delta;
        this.updatedAt = LocalDateTime.now();
    }
}
