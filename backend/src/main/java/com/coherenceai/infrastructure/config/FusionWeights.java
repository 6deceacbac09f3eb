package com.coherenceai.infrastructure.config;

import java.util.Map;

/**
 * Blend of the structural score with the sentiment confidence. Must sum to 1.0.
 */
public record FusionWeights(double structural, double sentiment) {

    public static final FusionWeights DEFAULT = new FusionWeights(0.7, 0.3);

    /**
     * Used when no sentiment signal is supplied.
     */
    public static final FusionWeights STRUCTURAL_ONLY = new FusionWeights(1.0, 0.0);

    public FusionWeights {
        WeightChecks.requireDistribution("weights.fusion",
                Map.of("structural", structural, "sentiment", sentiment));
    }
}
