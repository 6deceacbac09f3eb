package com.coherenceai.domain.analysis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Token, POS and lemma statistics for one text, produced by the upstream analyzer.
 * Empty collections are valid and mean "no signal".
 */
public record LinguisticBundle(
        int tokenCount,
        Map<String, Integer> posDistribution,
        List<String> keyLemmas,
        List<String> sentences,
        int sentenceCount,
        List<String> dependencyTypes,
        double avgTokenLength,
        List<TokenFeature> tokens
) {
    public LinguisticBundle {
        posDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(posDistribution));
        keyLemmas = List.copyOf(keyLemmas);
        sentences = List.copyOf(sentences);
        dependencyTypes = List.copyOf(dependencyTypes);
        tokens = List.copyOf(tokens);
    }

    /**
     * Bundle without a token stream (command patterns will not match).
     */
    public LinguisticBundle(int tokenCount, Map<String, Integer> posDistribution, List<String> keyLemmas,
                            List<String> sentences, int sentenceCount, List<String> dependencyTypes,
                            double avgTokenLength) {
        this(tokenCount, posDistribution, keyLemmas, sentences, sentenceCount, dependencyTypes,
                avgTokenLength, List.of());
    }

    /**
     * Number of distinct POS categories with at least one token. Tags are compared ignoring case.
     */
    public int posDiversity() {
        return (int) posDistribution.entrySet().stream()
                .filter(entry -> entry.getKey() != null && entry.getValue() != null && entry.getValue() > 0)
                .map(entry -> entry.getKey().toUpperCase(Locale.ROOT))
                .distinct()
                .count();
    }
}
