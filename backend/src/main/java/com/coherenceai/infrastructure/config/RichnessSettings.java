package com.coherenceai.infrastructure.config;

/**
 * Calibration points of the richness score: a "fully rich" short utterance has
 * {@code tokenNorm} tokens spread over {@code posNorm} POS categories.
 */
public record RichnessSettings(double tokenNorm, double posNorm) {

    public static final RichnessSettings DEFAULT = new RichnessSettings(20.0, 5.0);

    public RichnessSettings {
        if (!(tokenNorm > 0.0) || !(posNorm > 0.0)) {
            throw new InvalidConfigurationException(
                    "richness.tokenNorm and richness.posNorm must be positive but were " + tokenNorm + ", " + posNorm);
        }
    }
}
