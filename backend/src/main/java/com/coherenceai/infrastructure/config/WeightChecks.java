package com.coherenceai.infrastructure.config;

import java.util.Map;

final class WeightChecks {

    static final double TOLERANCE = 1e-6;

    private WeightChecks() {
    }

    static void requireDistribution(String group, Map<String, Double> weights) {
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            double weight = entry.getValue();
            if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
                throw new InvalidConfigurationException(
                        String.format("%s.%s must be in [0, 1] but was %s", group, entry.getKey(), weight));
            }
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new InvalidConfigurationException(
                    String.format("%s must sum to 1.0 but sums to %s", group, sum));
        }
    }
}
