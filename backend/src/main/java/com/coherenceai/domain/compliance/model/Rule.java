package com.coherenceai.domain.compliance.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One configured compliance rule. The variants are closed; the rule engine dispatches on {@link #kind()}.
 * Lemma and emotion sets keep their configured order so findings come out in a stable order.
 */
public sealed interface Rule {

    RuleKind kind();

    /**
     * Any morphological match is a violation.
     */
    record ProhibitedConcept(Set<String> lemmas) implements Rule {
        public ProhibitedConcept {
            lemmas = orderedCopy(lemmas);
        }

        @Override
        public RuleKind kind() {
            return RuleKind.PROHIBITED_CONCEPT;
        }
    }

    /**
     * Matches are a positive signal and never produce a finding.
     */
    record RequiredVirtue(Set<String> lemmas) implements Rule {
        public RequiredVirtue {
            lemmas = orderedCopy(lemmas);
        }

        @Override
        public RuleKind kind() {
            return RuleKind.REQUIRED_VIRTUE;
        }
    }

    /**
     * Fires when the emotion score is strictly greater than the threshold.
     */
    record EmotionThreshold(String emotion, double threshold, Severity severity) implements Rule {
        @Override
        public RuleKind kind() {
            return RuleKind.EMOTION_THRESHOLD;
        }
    }

    /**
     * Fires only when every listed emotion is strictly above the joint threshold.
     */
    record EmotionCombination(Set<String> emotions, double jointThreshold, Severity severity) implements Rule {
        public EmotionCombination {
            emotions = orderedCopy(emotions);
        }

        @Override
        public RuleKind kind() {
            return RuleKind.EMOTION_COMBINATION;
        }
    }

    record RelationshipPattern(Set<String> predicateLemmas, Severity severity) implements Rule {
        public RelationshipPattern {
            predicateLemmas = orderedCopy(predicateLemmas);
        }

        @Override
        public RuleKind kind() {
            return RuleKind.RELATIONSHIP_PATTERN;
        }
    }

    /**
     * Contiguous POS run, e.g. {@code ["VERB", "NOUN|PRON"]}. An element may list alternatives separated by '|'.
     */
    record CommandPattern(List<String> posSequence, Severity severity) implements Rule {
        public CommandPattern {
            posSequence = List.copyOf(posSequence);
        }

        public CommandPattern(List<String> posSequence) {
            this(posSequence, Severity.WARNING);
        }

        @Override
        public RuleKind kind() {
            return RuleKind.COMMAND_PATTERN;
        }

        public List<Set<String>> alternatives() {
            return posSequence.stream()
                    .map(element -> Arrays.stream(element.split("\\|"))
                            .map(String::strip)
                            .filter(pos -> !pos.isEmpty())
                            .map(pos -> pos.toUpperCase(Locale.ROOT))
                            .collect(Collectors.toCollection(LinkedHashSet::new)))
                    .map(Collections::unmodifiableSet)
                    .toList();
        }
    }

    private static Set<String> orderedCopy(Set<String> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
