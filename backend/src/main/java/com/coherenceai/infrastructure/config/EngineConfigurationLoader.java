package com.coherenceai.infrastructure.config;

import com.coherenceai.domain.compliance.model.Rule;
import com.coherenceai.domain.compliance.model.RuleKind;
import com.coherenceai.domain.compliance.model.RuleSet;
import com.coherenceai.domain.compliance.model.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses the engine configuration document (rules, weights, normalization constants).
 * <p>
 * Every problem is reported as {@link InvalidConfigurationException}; nothing falls back to defaults
 * except the optional {@code weights}, {@code richness} and {@code concept} sections.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngineConfigurationLoader {

    private final ObjectMapper objectMapper;

    public EngineConfiguration load(Resource resource) {
        if (!resource.exists()) {
            throw new InvalidConfigurationException("Engine configuration not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new InvalidConfigurationException(
                    "Could not read engine configuration: " + resource.getDescription(), e);
        }
    }

    public EngineConfiguration parse(String document) {
        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException("Engine configuration is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidConfigurationException("Engine configuration must be a JSON object");
        }

        RuleSet ruleSet = parseRules(root.get("rules"));

        JsonNode weights = root.path("weights");
        StructuralWeights structural = weights.has("structural")
                ? parseStructuralWeights(weights.get("structural"))
                : StructuralWeights.DEFAULT;
        FusionWeights fusion = weights.has("fusion")
                ? parseFusionWeights(weights.get("fusion"))
                : FusionWeights.DEFAULT;

        RichnessSettings richness = root.has("richness")
                ? new RichnessSettings(
                        requireNumber(root.get("richness"), "tokenNorm", "richness"),
                        requireNumber(root.get("richness"), "posNorm", "richness"))
                : RichnessSettings.DEFAULT;

        double conceptNorm = root.has("concept")
                ? requireNumber(root.get("concept"), "normalizationConstant", "concept")
                : EngineConfiguration.DEFAULT_CONCEPT_NORMALIZATION;

        EngineConfiguration configuration = new EngineConfiguration(
                root.path("version").asText("unversioned"),
                root.path("description").asText(""),
                ruleSet, structural, fusion, richness, conceptNorm);

        log.debug("Parsed engine configuration version={} with {} rules",
                configuration.version(), ruleSet.size());
        return configuration;
    }

    // ===== Rules =====

    private RuleSet parseRules(JsonNode rulesNode) {
        if (rulesNode == null || !rulesNode.isArray()) {
            throw new InvalidConfigurationException("'rules' must be an array");
        }
        List<Rule> rules = new ArrayList<>();
        for (int i = 0; i < rulesNode.size(); i++) {
            rules.add(parseRule(rulesNode.get(i), "rules[" + i + "]"));
        }
        return new RuleSet(rules);
    }

    private Rule parseRule(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new InvalidConfigurationException(path + " must be an object");
        }
        RuleKind kind = parseKind(requireText(node, "type", path), path);

        return switch (kind) {
            case PROHIBITED_CONCEPT -> new Rule.ProhibitedConcept(requireStringSet(node, "lemmas", path));
            case REQUIRED_VIRTUE -> new Rule.RequiredVirtue(requireStringSet(node, "lemmas", path));
            case EMOTION_THRESHOLD -> new Rule.EmotionThreshold(
                    requireText(node, "emotion", path),
                    requireUnitInterval(node, "threshold", path),
                    parseSeverity(node, path, Severity.WARNING));
            case EMOTION_COMBINATION -> new Rule.EmotionCombination(
                    requireStringSet(node, "emotions", path),
                    requireUnitInterval(node, "jointThreshold", path),
                    parseSeverity(node, path, Severity.VIOLATION));
            case RELATIONSHIP_PATTERN -> new Rule.RelationshipPattern(
                    requireStringSet(node, "predicateLemmas", path),
                    parseSeverity(node, path, Severity.WARNING));
            case COMMAND_PATTERN -> new Rule.CommandPattern(
                    requireStringList(node, "posSequence", path),
                    parseSeverity(node, path, Severity.WARNING));
        };
    }

    private RuleKind parseKind(String type, String path) {
        try {
            return RuleKind.valueOf(type.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(path + ".type: unknown rule type '" + type + "'", e);
        }
    }

    private Severity parseSeverity(JsonNode node, String path, Severity defaultSeverity) {
        JsonNode severity = node.get("severity");
        if (severity == null || severity.isNull()) {
            return defaultSeverity;
        }
        try {
            return Severity.valueOf(severity.asText().strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(
                    path + ".severity: unknown severity '" + severity.asText() + "'", e);
        }
    }

    // ===== Weights =====

    private StructuralWeights parseStructuralWeights(JsonNode node) {
        return new StructuralWeights(
                requireNumber(node, "compliance", "weights.structural"),
                requireNumber(node, "richness", "weights.structural"),
                requireNumber(node, "concept", "weights.structural"));
    }

    private FusionWeights parseFusionWeights(JsonNode node) {
        return new FusionWeights(
                requireNumber(node, "structural", "weights.fusion"),
                requireNumber(node, "sentiment", "weights.fusion"));
    }

    // ===== Field helpers =====

    private String requireText(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new InvalidConfigurationException(path + "." + field + " is required");
        }
        return value.asText().strip();
    }

    private double requireNumber(JsonNode node, String field, String path) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isNumber()) {
            throw new InvalidConfigurationException(path + "." + field + " must be a number");
        }
        return value.asDouble();
    }

    private double requireUnitInterval(JsonNode node, String field, String path) {
        double value = requireNumber(node, field, path);
        if (value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException(path + "." + field + " must be in [0, 1] but was " + value);
        }
        return value;
    }

    private Set<String> requireStringSet(JsonNode node, String field, String path) {
        return new LinkedHashSet<>(requireStringList(node, field, path));
    }

    private List<String> requireStringList(JsonNode node, String field, String path) {
        JsonNode array = node.get(field);
        if (array == null || !array.isArray() || array.isEmpty()) {
            throw new InvalidConfigurationException(path + "." + field + " must be a non-empty array");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : array) {
            if (!element.isTextual() || element.asText().isBlank()) {
                throw new InvalidConfigurationException(path + "." + field + " must contain only non-blank strings");
            }
            values.add(element.asText().strip());
        }
        return values;
    }
}
