package com.coherenceai.infrastructure.engine.fusion;

import com.coherenceai.domain.analysis.model.AnalysisRequest;
import com.coherenceai.domain.analysis.model.Concept;
import com.coherenceai.domain.analysis.model.EmotionVector;
import com.coherenceai.domain.analysis.model.InteractionContext;
import com.coherenceai.domain.analysis.model.LinguisticBundle;
import com.coherenceai.domain.analysis.model.SentimentSignal;
import com.coherenceai.domain.compliance.model.ComplianceResult;
import com.coherenceai.domain.compliance.model.Finding;
import com.coherenceai.domain.compliance.model.PatternMatchCounts;
import com.coherenceai.domain.compliance.model.RuleKind;
import com.coherenceai.domain.compliance.model.RuleSet;
import com.coherenceai.domain.compliance.model.Severity;
import com.coherenceai.domain.fusion.model.CoherenceBreakdown;
import com.coherenceai.domain.fusion.model.FusionResult;
import com.coherenceai.infrastructure.config.EngineConfiguration;
import com.coherenceai.infrastructure.config.FusionWeights;
import com.coherenceai.infrastructure.config.RichnessSettings;
import com.coherenceai.infrastructure.config.StructuralWeights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FusionArbiterTest {

    private static final EngineConfiguration DEFAULTS = EngineConfiguration.withDefaults(RuleSet.of());

    private FusionArbiter arbiter;

    @BeforeEach
    void setUp() {
        arbiter = new FusionArbiter();
    }

    private static ComplianceResult compliant() {
        return ComplianceResult.of(List.of(), List.of(), Set.of("respect", "fairness"), PatternMatchCounts.none());
    }

    private static ComplianceResult violated() {
        Finding finding = new Finding(RuleKind.PROHIBITED_CONCEPT, Severity.VIOLATION,
                "violent", "violence", "Prohibited concept 'violence' matched 'violent' in key lemmas");
        return ComplianceResult.of(List.of(finding), List.of(), Set.of(), new PatternMatchCounts(0, 1, 0));
    }

    @Nested
    @DisplayName("Structural score")
    class StructuralTests {
        @Test
        void compliant_rich_text_scores_0_832() {
            CoherenceBreakdown breakdown = arbiter.computeCoherence(compliant(), 0.56, 3, null, DEFAULTS);

            assertThat(breakdown.complianceTerm()).isEqualTo(1.0);
            assertThat(breakdown.conceptScore()).isCloseTo(0.6, within(1e-9));
            assertThat(breakdown.structuralScore()).isCloseTo(0.832, within(1e-9));
            assertThat(breakdown.coherence()).isCloseTo(0.832, within(1e-9));
        }

        @Test
        void violation_zeroes_the_compliance_term() {
            CoherenceBreakdown breakdown = arbiter.computeCoherence(violated(), 0.56, 3, null, DEFAULTS);

            assertThat(breakdown.complianceTerm()).isZero();
            assertThat(breakdown.structuralScore()).isCloseTo(0.232, within(1e-9));
        }

        @Test
        void concept_score_saturates_at_k() {
            CoherenceBreakdown breakdown = arbiter.computeCoherence(compliant(), 1.0, 12, null, DEFAULTS);

            assertThat(breakdown.conceptScore()).isEqualTo(1.0);
            assertThat(breakdown.coherence()).isCloseTo(1.0, within(1e-9));
        }

        @Test
        void out_of_range_richness_is_clamped() {
            assertThat(arbiter.computeCoherence(compliant(), 3.0, 0, null, DEFAULTS).richness()).isEqualTo(1.0);
            assertThat(arbiter.computeCoherence(compliant(), -1.0, 0, null, DEFAULTS).richness()).isZero();
        }

        @Test
        void configured_weights_are_applied() {
            EngineConfiguration custom = new EngineConfiguration("custom", "", RuleSet.of(),
                    new StructuralWeights(0.5, 0.25, 0.25), FusionWeights.DEFAULT, RichnessSettings.DEFAULT, 10.0);

            CoherenceBreakdown breakdown = arbiter.computeCoherence(compliant(), 0.4, 5, null, custom);

            // 0.5 + 0.4 * 0.25 + 0.5 * 0.25
            assertThat(breakdown.structuralScore()).isCloseTo(0.725, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Sentiment blend")
    class SentimentTests {
        @Test
        void sentiment_confidence_is_blended_with_fusion_weights() {
            CoherenceBreakdown breakdown = arbiter.computeCoherence(
                    compliant(), 0.56, 3, new SentimentSignal("positive", 0.9), DEFAULTS);

            // 0.832 * 0.7 + 0.9 * 0.3
            assertThat(breakdown.coherence()).isCloseTo(0.8524, within(1e-9));
            assertThat(breakdown.weightsUsed()).containsEntry("structural", 0.7).containsEntry("sentiment", 0.3);
        }

        @Test
        void without_sentiment_the_structural_score_is_authoritative() {
            CoherenceBreakdown breakdown = arbiter.computeCoherence(compliant(), 0.56, 3, null, DEFAULTS);

            assertThat(breakdown.weightsUsed()).containsExactly(
                    Map.entry("compliance", 0.6),
                    Map.entry("richness", 0.2),
                    Map.entry("concept", 0.2),
                    Map.entry("structural", 1.0),
                    Map.entry("sentiment", 0.0));
        }
    }

    @Test
    @DisplayName("Same inputs give the same coherence")
    void fusion_is_idempotent() {
        CoherenceBreakdown first = arbiter.computeCoherence(compliant(), 0.42, 2, null, DEFAULTS);
        CoherenceBreakdown second = arbiter.computeCoherence(compliant(), 0.42, 2, null, DEFAULTS);

        assertThat(second.coherence()).isEqualTo(first.coherence());
        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("fuse passes inputs through and fills the summary")
    void fuse_assembles_result() {
        LinguisticBundle bundle = new LinguisticBundle(14, Map.of("NOUN", 5, "VERB", 4, "ADJ", 3, "DET", 2),
                List.of("respect", "fairness"), List.of("We value respect and fairness."), 1, List.of("nsubj"), 5.1);
        List<Concept> concepts = List.of(
                new Concept("respect", "respect", "CONCEPT", "NOUN", "general"),
                new Concept("fairness", "fairness", "CONCEPT", "NOUN", "general"),
                new Concept("team", "team", "CONCEPT", "NOUN", "general"));
        EmotionVector emotions = new EmotionVector(Map.of("joy", 0.4));
        AnalysisRequest request = new AnalysisRequest(bundle, List.of(), concepts, List.of(), emotions,
                null, new InteractionContext(7));

        FusionResult result = arbiter.fuse(request, compliant(), 0.56, DEFAULTS);

        assertThat(result.coherence()).isCloseTo(0.832, within(1e-9));
        assertThat(result.compliant()).isTrue();
        assertThat(result.concepts()).isEqualTo(concepts);
        assertThat(result.emotions()).isEqualTo(emotions);
        assertThat(result.linguisticFeatures()).isEqualTo(bundle);
        assertThat(result.summary().conceptCount()).isEqualTo(3);
        assertThat(result.summary().sentenceCount()).isEqualTo(1);
        assertThat(result.summary().priorInteractionCount()).isEqualTo(7);
    }
}
