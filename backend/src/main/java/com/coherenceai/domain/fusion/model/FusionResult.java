package com.coherenceai.domain.fusion.model;

import com.coherenceai.domain.analysis.model.Concept;
import com.coherenceai.domain.analysis.model.EmotionVector;
import com.coherenceai.domain.analysis.model.LinguisticBundle;
import com.coherenceai.domain.analysis.model.NamedEntity;
import com.coherenceai.domain.analysis.model.Relationship;
import com.coherenceai.domain.analysis.model.SentimentSignal;
import com.coherenceai.domain.compliance.model.ComplianceResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unified output for one request: the fused coherence score plus the analyzer data passed through unchanged.
 *
 * @param coherence   fused score in [0, 1]
 * @param sentiment   sentiment signal as supplied (nullable)
 * @param weightsUsed weights actually applied, keyed compliance/richness/concept/structural/sentiment
 */
public record FusionResult(
        double coherence,
        double structuralScore,
        double richness,
        double conceptScore,
        SentimentSignal sentiment,
        EmotionVector emotions,
        List<Concept> concepts,
        List<NamedEntity> entities,
        List<Relationship> relationships,
        LinguisticBundle linguisticFeatures,
        ComplianceResult compliance,
        Map<String, Double> weightsUsed,
        FusionSummary summary
) {
    public FusionResult {
        concepts = List.copyOf(concepts);
        entities = List.copyOf(entities);
        relationships = List.copyOf(relationships);
        weightsUsed = Collections.unmodifiableMap(new LinkedHashMap<>(weightsUsed));
    }

    public boolean compliant() {
        return compliance.compliant();
    }
}
