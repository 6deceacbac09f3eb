package com.coherenceai.domain.fusion.model;

public record FusionSummary(
        int conceptCount,
        int entityCount,
        int relationshipCount,
        int sentenceCount,
        int violationCount,
        int warningCount,
        int priorInteractionCount
) {}
