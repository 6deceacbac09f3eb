package com.coherenceai.domain.analysis.model;

/**
 * A concept extracted from the text. Identity for storage is {@code (name, entityType)}.
 *
 * @param frequency sightings so far; always 1 for freshly extracted concepts
 */
public record Concept(
        String name,
        String lemma,
        String entityType,
        String posTag,
        String category,
        int frequency
) {
    public Concept {
        if (frequency < 1) {
            throw new IllegalArgumentException("Concept frequency must be >= 1 but was " + frequency);
        }
    }

    public Concept(String name, String lemma, String entityType, String posTag, String category) {
        this(name, lemma, entityType, posTag, category, 1);
    }

    /**
     * Promote a named entity to a concept, categorizing it by its NER label.
     */
    public static Concept fromEntity(NamedEntity entity) {
        String lemma = entity.lemma() != null ? entity.lemma() : entity.text();
        String posTag = entity.rootPos() != null ? entity.rootPos() : "UNKNOWN";
        return new Concept(entity.text(), lemma, entity.label(), posTag,
                ConceptCategory.fromEntityLabel(entity.label()).value());
    }
}
