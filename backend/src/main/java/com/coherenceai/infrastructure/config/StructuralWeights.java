package com.coherenceai.infrastructure.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weights of the structural score. Must be non-negative and sum to 1.0.
 */
public record StructuralWeights(double compliance, double richness, double concept) {

    public static final StructuralWeights DEFAULT = new StructuralWeights(0.6, 0.2, 0.2);

    public StructuralWeights {
        WeightChecks.requireDistribution("weights.structural",
                Map.of("compliance", compliance, "richness", richness, "concept", concept));
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("compliance", compliance);
        map.put("richness", richness);
        map.put("concept", concept);
        return map;
    }
}
