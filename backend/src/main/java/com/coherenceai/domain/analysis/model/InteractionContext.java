package com.coherenceai.domain.analysis.model;

/**
 * Prior-interaction context supplied by the interaction-memory collaborator.
 */
public record InteractionContext(int priorInteractionCount) {

    public static InteractionContext none() {
        return new InteractionContext(0);
    }
}
