package com.coherenceai.domain.knowledge.model;

import com.coherenceai.domain.analysis.model.Concept;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "concepts",
        uniqueConstraints = @UniqueConstraint(name = "uk_concepts_name_type", columnNames = {"name", "entity_type"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ConceptRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 255)
    private String lemma;

    @Column(name = "entity_type", nullable = false, length = 64)
    private String entityType;

    @Column(name = "pos_tag", length = 32)
    private String posTag;

    @Column(length = 64)
    private String category;

    @Column(nullable = false)
    private int frequency;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public ConceptRecord(Concept concept) {
        this.name = concept.name();
        this.lemma = concept.lemma() != null ? concept.lemma() : concept.name();
        this.entityType = concept.entityType() != null ? concept.entityType() : "unknown";
        this.posTag = concept.posTag() != null ? concept.posTag() : "UNKNOWN";
        this.category = concept.category() != null ? concept.category() : "general";
        this.frequency = 1;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    public void recordSighting() {
        this.frequency++;
        this.updatedAt = LocalDateTime.now();
    }

    public Concept toConcept() {
        return new Concept(name, lemma, entityType, posTag, category, frequency);
    }
}
