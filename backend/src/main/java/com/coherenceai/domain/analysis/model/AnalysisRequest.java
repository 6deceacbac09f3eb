package com.coherenceai.domain.analysis.model;

import java.util.List;

/**
 * Everything the upstream analyzers produced for one text.
 *
 * @param sentiment   optional sentiment signal (nullable)
 * @param interaction optional prior-interaction context (nullable)
 */
public record AnalysisRequest(
        LinguisticBundle bundle,
        List<NamedEntity> entities,
        List<Concept> concepts,
        List<Relationship> relationships,
        EmotionVector emotions,
        SentimentSignal sentiment,
        InteractionContext interaction
) {
    public AnalysisRequest(LinguisticBundle bundle, List<NamedEntity> entities, List<Concept> concepts,
                           List<Relationship> relationships, EmotionVector emotions) {
        this(bundle, entities, concepts, relationships, emotions, null, null);
    }
}
