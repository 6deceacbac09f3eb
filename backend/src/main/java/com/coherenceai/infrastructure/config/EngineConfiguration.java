package com.coherenceai.infrastructure.config;

import com.coherenceai.domain.compliance.model.RuleSet;

/**
 * Immutable snapshot of everything the engine reads per request.
 * Published as a whole by {@link EngineConfigurationHolder}.
 */
public record EngineConfiguration(
        String version,
        String description,
        RuleSet ruleSet,
        StructuralWeights structuralWeights,
        FusionWeights fusionWeights,
        RichnessSettings richness,
        double conceptNormalizationConstant
) {
    public static final double DEFAULT_CONCEPT_NORMALIZATION = 5.0;

    public EngineConfiguration {
        if (ruleSet == null) {
            throw new InvalidConfigurationException("ruleSet is required");
        }
        if (!(conceptNormalizationConstant > 0.0)) {
            throw new InvalidConfigurationException(
                    "concept.normalizationConstant must be positive but was " + conceptNormalizationConstant);
        }
    }

    public static EngineConfiguration withDefaults(RuleSet ruleSet) {
        return new EngineConfiguration("default", "Built-in defaults", ruleSet,
                StructuralWeights.DEFAULT, FusionWeights.DEFAULT, RichnessSettings.DEFAULT,
                DEFAULT_CONCEPT_NORMALIZATION);
    }
}
