package com.coherenceai.domain.compliance.model;

/**
 * A rule that fired, with the evidence it fired on.
 *
 * @param ruleKind     kind of the rule that produced this finding
 * @param severity     VIOLATION blocks compliance, WARNING does not
 * @param matchedText  the text from the input that triggered the rule
 * @param matchedLemma the configured lemma/emotion/POS it matched ("" when not applicable)
 * @param reason       human-readable description
 */
public record Finding(
        RuleKind ruleKind,
        Severity severity,
        String matchedText,
        String matchedLemma,
        String reason
) {}
