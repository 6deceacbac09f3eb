package com.coherenceai.domain.analysis.model;

/**
 * Named entity recognized upstream. {@code label} comes from an open NER tagset.
 */
public record NamedEntity(
        String text,
        String label,
        String lemma,
        String rootPos,
        String rootDep
) {}
