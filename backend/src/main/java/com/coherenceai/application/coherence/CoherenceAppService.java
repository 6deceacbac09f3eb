package com.coherenceai.application.coherence;

import com.coherenceai.application.coherence.exception.MalformedInputException;
import com.coherenceai.domain.analysis.model.AnalysisRequest;
import com.coherenceai.domain.analysis.model.LinguisticBundle;
import com.coherenceai.domain.analysis.model.SentimentSignal;
import com.coherenceai.domain.compliance.model.ComplianceResult;
import com.coherenceai.domain.fusion.model.FusionResult;
import com.coherenceai.infrastructure.config.EngineConfiguration;
import com.coherenceai.infrastructure.config.EngineConfigurationHolder;
import com.coherenceai.infrastructure.engine.compliance.RuleEngine;
import com.coherenceai.infrastructure.engine.fusion.FusionArbiter;
import com.coherenceai.infrastructure.engine.scoring.RichnessScorer;
import com.coherenceai.infrastructure.persistence.KnowledgeWriteDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Runs one analyzer output through the engine:
 * <p>
 * validate → richness → rule evaluation → fusion → persistence dispatch (not awaited)
 * </p>
 * All steps read the same configuration snapshot, so a concurrent reload never mixes two versions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoherenceAppService {

    private final EngineConfigurationHolder configurationHolder;
    private final RichnessScorer richnessScorer;
    private final RuleEngine ruleEngine;
    private final FusionArbiter fusionArbiter;
    private final KnowledgeWriteDispatcher knowledgeWriteDispatcher;

    public FusionResult process(AnalysisRequest request) {
        validate(request);

        EngineConfiguration configuration = configurationHolder.current();

        double richness = richnessScorer.score(request.bundle(), configuration.richness());
        ComplianceResult compliance = ruleEngine.evaluate(request, configuration.ruleSet());
        if (!compliance.compliant()) {
            log.warn("Compliance violation: {}", compliance.reason());
        }

        FusionResult result = fusionArbiter.fuse(request, compliance, richness, configuration);

        try {
            knowledgeWriteDispatcher.dispatch(result);
        } catch (RuntimeException e) {
            log.error("Knowledge write dispatch failed; response is unaffected", e);
        }
        return result;
    }

    /**
     * Reject requests with a missing part instead of scoring them with silent defaults.
     */
    public void validate(AnalysisRequest request) {
        if (request == null) {
            throw new MalformedInputException("Analysis request is required");
        }
        LinguisticBundle bundle = request.bundle();
        if (bundle == null) {
            throw new MalformedInputException("Linguistic bundle is required");
        }
        if (request.emotions() == null) {
            throw new MalformedInputException("Emotion vector is required (it may be empty)");
        }
        if (request.entities() == null || request.concepts() == null || request.relationships() == null) {
            throw new MalformedInputException("Entities, concepts and relationships are required (they may be empty)");
        }
        requireNoNullElements(request.entities(), "entities");
        requireNoNullElements(request.concepts(), "concepts");
        requireNoNullElements(request.relationships(), "relationships");
        if (bundle.tokenCount() < 0 || bundle.sentenceCount() < 0 || bundle.avgTokenLength() < 0) {
            throw new MalformedInputException(String.format(
                    "Linguistic counts must be non-negative (tokens=%d, sentences=%d, avgTokenLength=%s)",
                    bundle.tokenCount(), bundle.sentenceCount(), bundle.avgTokenLength()));
        }
        for (Map.Entry<String, Double> score : request.emotions().scores().entrySet()) {
            if (!isUnit(score.getValue())) {
                throw new MalformedInputException(String.format(
                        "Emotion '%s' score must be in [0, 1] but was %s", score.getKey(), score.getValue()));
            }
        }
        SentimentSignal sentiment = request.sentiment();
        if (sentiment != null && !isUnit(sentiment.confidence())) {
            throw new MalformedInputException(
                    "Sentiment confidence must be in [0, 1] but was " + sentiment.confidence());
        }
        if (request.interaction() != null && request.interaction().priorInteractionCount() < 0) {
            throw new MalformedInputException("Prior interaction count must be non-negative");
        }
    }

    private static void requireNoNullElements(List<?> values, String field) {
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw new MalformedInputException(field + "[" + i + "] must not be null");
            }
        }
    }

    private static boolean isUnit(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}
