package com.coherenceai.infrastructure.engine.scoring;

import com.coherenceai.domain.analysis.model.LinguisticBundle;
import com.coherenceai.infrastructure.config.RichnessSettings;
import org.springframework.stereotype.Component;

/**
 * Linguistic richness in [0, 1]: rewards token volume and POS variety multiplicatively.
 * <pre>
 * richness = min(1, (tokenCount / tokenNorm) * (posDiversity / posNorm))
 * </pre>
 */
@Component
public class RichnessScorer {

    public double score(LinguisticBundle bundle) {
        return score(bundle, RichnessSettings.DEFAULT);
    }

    public double score(LinguisticBundle bundle, RichnessSettings settings) {
        return score(bundle.tokenCount(), bundle.posDiversity(), settings);
    }

    public double score(int tokenCount, int posDiversity, RichnessSettings settings) {
        if (tokenCount <= 0 || posDiversity <= 0) {
            return 0.0;
        }
        double richness = (tokenCount / settings.tokenNorm()) * (posDiversity / settings.posNorm());
        return Math.min(1.0, richness);
    }
}
