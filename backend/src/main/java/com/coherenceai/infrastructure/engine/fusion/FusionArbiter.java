package com.coherenceai.infrastructure.engine.fusion;

import com.coherenceai.domain.analysis.model.AnalysisRequest;
import com.coherenceai.domain.analysis.model.InteractionContext;
import com.coherenceai.domain.analysis.model.SentimentSignal;
import com.coherenceai.domain.compliance.model.ComplianceResult;
import com.coherenceai.domain.fusion.model.CoherenceBreakdown;
import com.coherenceai.domain.fusion.model.FusionResult;
import com.coherenceai.domain.fusion.model.FusionSummary;
import com.coherenceai.infrastructure.config.EngineConfiguration;
import com.coherenceai.infrastructure.config.FusionWeights;
import com.coherenceai.infrastructure.config.StructuralWeights;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fuses the compliance verdict, richness and concept density into one coherence score and
 * assembles the unified result.
 * <pre>
 * structural = compliance * wC + richness * wR + min(1, conceptCount / K) * wK
 * coherence  = structural * wS + sentimentConfidence * wSent   (structural alone without a sentiment signal)
 * </pre>
 * The only computed field is the coherence; everything else is passed through unchanged.
 */
@Slf4j
@Component
public class FusionArbiter {

    public FusionResult fuse(AnalysisRequest request,
                             ComplianceResult compliance,
                             double richness,
                             EngineConfiguration configuration) {
        CoherenceBreakdown breakdown = computeCoherence(
                compliance, richness, request.concepts().size(), request.sentiment(), configuration);

        InteractionContext interaction = request.interaction() != null
                ? request.interaction()
                : InteractionContext.none();

        FusionSummary summary = new FusionSummary(
                request.concepts().size(),
                request.entities().size(),
                request.relationships().size(),
                request.bundle().sentenceCount(),
                compliance.violations().size(),
                compliance.warnings().size(),
                interaction.priorInteractionCount());

        log.info("Fusion complete. coherence={}, structural={}, compliant={}",
                String.format("%.3f", breakdown.coherence()),
                String.format("%.3f", breakdown.structuralScore()),
                compliance.compliant());

        return new FusionResult(
                breakdown.coherence(),
                breakdown.structuralScore(),
                breakdown.richness(),
                breakdown.conceptScore(),
                request.sentiment(),
                request.emotions(),
                request.concepts(),
                request.entities(),
                request.relationships(),
                request.bundle(),
                compliance,
                breakdown.weightsUsed(),
                summary);
    }

    /**
     * Pure score composition; the same inputs always give the same breakdown.
     *
     * @param sentiment optional sentiment signal (nullable)
     */
    public CoherenceBreakdown computeCoherence(ComplianceResult compliance,
                                               double richness,
                                               int conceptCount,
                                               SentimentSignal sentiment,
                                               EngineConfiguration configuration) {
        StructuralWeights structuralWeights = configuration.structuralWeights();

        double complianceTerm = compliance.compliant() ? 1.0 : 0.0;
        double boundedRichness = clamp(richness);
        double conceptScore = Math.min(1.0, Math.max(0, conceptCount) / configuration.conceptNormalizationConstant());

        double structuralScore = complianceTerm * structuralWeights.compliance()
                + boundedRichness * structuralWeights.richness()
                + conceptScore * structuralWeights.concept();

        FusionWeights fusionWeights = selectFusionWeights(sentiment, configuration);
        double sentimentConfidence = sentiment != null ? clamp(sentiment.confidence()) : 0.0;
        double coherence = clamp(structuralScore * fusionWeights.structural()
                + sentimentConfidence * fusionWeights.sentiment());

        Map<String, Double> weightsUsed = new LinkedHashMap<>(structuralWeights.asMap());
        weightsUsed.put("structural", fusionWeights.structural());
        weightsUsed.put("sentiment", fusionWeights.sentiment());

        return new CoherenceBreakdown(complianceTerm, boundedRichness, conceptScore,
                structuralScore, coherence, weightsUsed);
    }

    /**
     * Without a sentiment signal the structural score is authoritative.
     */
    private FusionWeights selectFusionWeights(SentimentSignal sentiment, EngineConfiguration configuration) {
        return sentiment != null ? configuration.fusionWeights() : FusionWeights.STRUCTURAL_ONLY;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
