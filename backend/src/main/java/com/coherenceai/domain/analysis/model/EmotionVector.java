package com.coherenceai.domain.analysis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Multi-label emotion scores. Labels are case-insensitive; an absent label scores 0.0.
 */
public record EmotionVector(Map<String, Double> scores) {

    public EmotionVector {
        Map<String, Double> normalized = new LinkedHashMap<>();
        scores.forEach((label, score) -> normalized.put(
                Objects.requireNonNull(label, "emotion label").toLowerCase(Locale.ROOT),
                Objects.requireNonNull(score, () -> "score for emotion '" + label + "'")));
        scores = Collections.unmodifiableMap(normalized);
    }

    public static EmotionVector empty() {
        return new EmotionVector(Map.of());
    }

    public double scoreOf(String emotion) {
        return scores.getOrDefault(emotion.toLowerCase(Locale.ROOT), 0.0);
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }
}
