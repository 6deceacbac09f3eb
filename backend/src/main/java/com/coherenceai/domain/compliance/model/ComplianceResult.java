package com.coherenceai.domain.compliance.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Verdict of one rule evaluation. {@code compliant} is always {@code violations.isEmpty()}.
 */
public record ComplianceResult(
        boolean compliant,
        List<Finding> violations,
        List<Finding> warnings,
        Set<String> requiredValuesPresent,
        PatternMatchCounts counts
) {
    public ComplianceResult {
        violations = List.copyOf(violations);
        warnings = List.copyOf(warnings);
        requiredValuesPresent = Collections.unmodifiableSet(new LinkedHashSet<>(requiredValuesPresent));
        if (compliant != violations.isEmpty()) {
            throw new IllegalArgumentException("compliant must be true iff there are no violations");
        }
    }

    public static ComplianceResult of(List<Finding> violations, List<Finding> warnings,
                                      Set<String> requiredValuesPresent, PatternMatchCounts counts) {
        return new ComplianceResult(violations.isEmpty(), violations, warnings, requiredValuesPresent, counts);
    }

    /**
     * Violations followed by warnings.
     */
    public List<Finding> findings() {
        List<Finding> all = new ArrayList<>(violations);
        all.addAll(warnings);
        return Collections.unmodifiableList(all);
    }

    public String reason() {
        if (compliant) {
            return "Compliant";
        }
        String first = violations.get(0).reason();
        return violations.size() == 1 ? first : first + " (+" + (violations.size() - 1) + " more)";
    }
}
