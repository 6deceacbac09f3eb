package com.coherenceai.infrastructure.config;

import com.coherenceai.domain.compliance.model.Rule;
import com.coherenceai.domain.compliance.model.RuleKind;
import com.coherenceai.domain.compliance.model.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;

import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigurationLoaderTest {

    private EngineConfigurationLoader loader;

    @BeforeEach
    void setUp() {
        loader = new EngineConfigurationLoader(new ObjectMapper());
    }

    private static String withRules(String rules) {
        return "{\"version\": \"t\", \"rules\": [" + rules + "]}";
    }

    @Nested
    @DisplayName("Valid documents")
    class ValidTests {
        @Test
        void bundled_default_configuration_loads() {
            EngineConfiguration configuration = loader.load(new ClassPathResource("engine-config.json"));

            assertThat(configuration.ruleSet().rules()).extracting(Rule::kind).contains(
                    RuleKind.PROHIBITED_CONCEPT, RuleKind.REQUIRED_VIRTUE, RuleKind.EMOTION_THRESHOLD,
                    RuleKind.EMOTION_COMBINATION, RuleKind.RELATIONSHIP_PATTERN, RuleKind.COMMAND_PATTERN);
            assertThat(configuration.structuralWeights()).isEqualTo(StructuralWeights.DEFAULT);
            assertThat(configuration.fusionWeights()).isEqualTo(FusionWeights.DEFAULT);
            assertThat(configuration.richness()).isEqualTo(RichnessSettings.DEFAULT);
            assertThat(configuration.conceptNormalizationConstant()).isEqualTo(5.0);
        }

        @Test
        void every_rule_kind_is_parsed() {
            EngineConfiguration configuration = loader.parse(withRules("""
                    {"type": "PROHIBITED_CONCEPT", "lemmas": ["violence", "harm"]},
                    {"type": "required_virtue", "lemmas": ["justice"]},
                    {"type": "EMOTION_THRESHOLD", "emotion": "anger", "threshold": 0.8},
                    {"type": "EMOTION_COMBINATION", "emotions": ["anger", "disgust"], "jointThreshold": 0.7},
                    {"type": "RELATIONSHIP_PATTERN", "predicateLemmas": ["threaten"], "severity": "violation"},
                    {"type": "COMMAND_PATTERN", "posSequence": ["VERB", "NOUN|PRON"]}
                    """));

            List<Rule> rules = configuration.ruleSet().rules();
            assertThat(rules).hasSize(6);
            assertThat(rules.get(0)).isEqualTo(new Rule.ProhibitedConcept(
                    new LinkedHashSet<>(List.of("violence", "harm"))));
            assertThat(((Rule.EmotionThreshold) rules.get(2)).severity()).isEqualTo(Severity.WARNING);
            assertThat(((Rule.EmotionCombination) rules.get(3)).severity()).isEqualTo(Severity.VIOLATION);
            assertThat(((Rule.RelationshipPattern) rules.get(4)).severity()).isEqualTo(Severity.VIOLATION);
            assertThat(((Rule.CommandPattern) rules.get(5)).posSequence()).containsExactly("VERB", "NOUN|PRON");
        }

        @Test
        void missing_optional_sections_take_defaults() {
            EngineConfiguration configuration = loader.parse("{\"rules\": []}");

            assertThat(configuration.version()).isEqualTo("unversioned");
            assertThat(configuration.ruleSet().size()).isZero();
            assertThat(configuration.structuralWeights()).isEqualTo(StructuralWeights.DEFAULT);
        }

        @Test
        void custom_weights_and_norms() {
            EngineConfiguration configuration = loader.parse("""
                    {"rules": [],
                     "weights": {"structural": {"compliance": 0.5, "richness": 0.3, "concept": 0.2},
                                 "fusion": {"structural": 0.6, "sentiment": 0.4}},
                     "richness": {"tokenNorm": 30, "posNorm": 6},
                     "concept": {"normalizationConstant": 8}}
                    """);

            assertThat(configuration.structuralWeights()).isEqualTo(new StructuralWeights(0.5, 0.3, 0.2));
            assertThat(configuration.fusionWeights()).isEqualTo(new FusionWeights(0.6, 0.4));
            assertThat(configuration.richness()).isEqualTo(new RichnessSettings(30, 6));
            assertThat(configuration.conceptNormalizationConstant()).isEqualTo(8.0);
        }
    }

    @Nested
    @DisplayName("Rejected documents")
    class RejectedTests {
        @Test
        void unknown_rule_type() {
            assertThatThrownBy(() -> loader.parse(withRules("{\"type\": \"SARCASM\", \"lemmas\": [\"x\"]}")))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("unknown rule type 'SARCASM'");
        }

        @Test
        void unknown_severity() {
            assertThatThrownBy(() -> loader.parse(withRules(
                    "{\"type\": \"EMOTION_THRESHOLD\", \"emotion\": \"anger\", \"threshold\": 0.5, \"severity\": \"FATAL\"}")))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("severity");
        }

        @Test
        void structural_weights_not_summing_to_one() {
            assertThatThrownBy(() -> loader.parse("""
                    {"rules": [], "weights": {"structural": {"compliance": 0.6, "richness": 0.3, "concept": 0.2}}}
                    """))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("sum to 1.0");
        }

        @Test
        void threshold_outside_unit_interval() {
            assertThatThrownBy(() -> loader.parse(withRules(
                    "{\"type\": \"EMOTION_THRESHOLD\", \"emotion\": \"anger\", \"threshold\": 1.5}")))
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        void empty_lemma_list() {
            assertThatThrownBy(() -> loader.parse(withRules("{\"type\": \"PROHIBITED_CONCEPT\", \"lemmas\": []}")))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("non-empty");
        }

        @Test
        void missing_rules() {
            assertThatThrownBy(() -> loader.parse("{\"version\": \"1\"}"))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("'rules'");
        }

        @Test
        void non_positive_norm() {
            assertThatThrownBy(() -> loader.parse("{\"rules\": [], \"richness\": {\"tokenNorm\": 0, \"posNorm\": 5}}"))
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        void malformed_json() {
            assertThatThrownBy(() -> loader.parse("{\"rules\": ["))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("not valid JSON");
        }

        @Test
        void missing_file() {
            assertThatThrownBy(() -> loader.load(new FileSystemResource("/nonexistent/engine-config.json")))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("not found");
        }
    }
}
