package com.coherenceai.domain.compliance.model;

/**
 * @param ethicalMatches required-virtue matches
 * @param harmMatches    prohibited-concept and relationship-pattern matches
 * @param commandMatches command-pattern matches
 */
public record PatternMatchCounts(int ethicalMatches, int harmMatches, int commandMatches) {

    public static PatternMatchCounts none() {
        return new PatternMatchCounts(0, 0, 0);
    }
}
