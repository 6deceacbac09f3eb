package com.coherenceai.infrastructure.engine.morphology;

import org.springframework.stereotype.Component;

/**
 * Tolerant lemma comparison without a stemmer.
 * <p>
 * Two lemmas match when they are equal ignoring case, or when both have at least 4 characters
 * and agree (ignoring case) on their first {@code min(len) - 3} characters, which absorbs regular
 * suffix inflection such as "manipulate" / "manipulation". Shorter words only match exactly
 * ("act" never matches "art").
 * </p>
 * Pure and commutative.
 */
@Component
public class MorphologicalMatcher {

    static final int MIN_STEM_LENGTH = 4;
    static final int SUFFIX_ALLOWANCE = 3;

    public boolean matches(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return false;
        }
        if (a.equalsIgnoreCase(b)) {
            return true;
        }
        if (a.length() < MIN_STEM_LENGTH || b.length() < MIN_STEM_LENGTH) {
            return false;
        }
        int prefixLength = Math.min(a.length(), b.length()) - SUFFIX_ALLOWANCE;
        if (prefixLength < 1) {
            return false;
        }
        return a.regionMatches(true, 0, b, 0, prefixLength);
    }
}
