package com.coherenceai.domain.compliance.model;

public enum RuleKind {
    PROHIBITED_CONCEPT,
    REQUIRED_VIRTUE,
    EMOTION_THRESHOLD,
    EMOTION_COMBINATION,
    RELATIONSHIP_PATTERN,
    COMMAND_PATTERN
}
