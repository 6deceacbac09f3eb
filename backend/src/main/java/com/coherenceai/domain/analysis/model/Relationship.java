package com.coherenceai.domain.analysis.model;

/**
 * Subject-predicate-object triple derived from the dependency parse.
 *
 * @param dependencyType e.g. "nsubj-dobj" or "prep-pobj"
 * @param verbTense      fine-grained verb tag, "N/A" for prepositional relations
 * @param strength       relation weight, 1.0 unless re-weighted
 */
public record Relationship(
        String subject,
        String predicate,
        String predicateLemma,
        String object,
        String dependencyType,
        String verbTense,
        double strength
) {
    public static final double DEFAULT_STRENGTH = 1.0;

    public Relationship(String subject, String predicate, String predicateLemma, String object,
                        String dependencyType, String verbTense) {
        this(subject, predicate, predicateLemma, object, dependencyType, verbTense, DEFAULT_STRENGTH);
    }
}
