package com.coherenceai.domain.analysis.model;

/**
 * Top sentiment label and its confidence in [0, 1].
 */
public record SentimentSignal(String label, double confidence) {}
