package com.coherenceai.domain.analysis.model;

/**
 * A single token as tagged by the upstream linguistic analyzer.
 *
 * @param text  surface form
 * @param lemma base form
 * @param pos   coarse part-of-speech tag (VERB, NOUN, PRON, ...)
 * @param tag   fine-grained tag (VB, VBP, NN, ...)
 * @param dep   dependency label (nsubj, dobj, ...)
 */
public record TokenFeature(
        String text,
        String lemma,
        String pos,
        String tag,
        String dep
) {}
