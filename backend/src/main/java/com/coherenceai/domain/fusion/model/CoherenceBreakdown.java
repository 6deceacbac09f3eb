package com.coherenceai.domain.fusion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The computed parts of a fusion: component scores, the final coherence and the weights applied.
 */
public record CoherenceBreakdown(
        double complianceTerm,
        double richness,
        double conceptScore,
        double structuralScore,
        double coherence,
        Map<String, Double> weightsUsed
) {
    public CoherenceBreakdown {
        weightsUsed = Collections.unmodifiableMap(new LinkedHashMap<>(weightsUsed));
    }
}
