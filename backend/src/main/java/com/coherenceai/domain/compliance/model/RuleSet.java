package com.coherenceai.domain.compliance.model;

import java.util.List;

/**
 * Ordered rules. Order carries no precedence, only the order in which findings are reported.
 */
public record RuleSet(List<Rule> rules) {

    public RuleSet {
        rules = List.copyOf(rules);
    }

    public static RuleSet of(Rule... rules) {
        return new RuleSet(List.of(rules));
    }

    public int size() {
        return rules.size();
    }
}
