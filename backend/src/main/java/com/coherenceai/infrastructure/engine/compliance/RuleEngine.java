package com.coherenceai.infrastructure.engine.compliance;

import com.coherenceai.domain.analysis.model.AnalysisRequest;
import com.coherenceai.domain.analysis.model.Concept;
import com.coherenceai.domain.analysis.model.EmotionVector;
import com.coherenceai.domain.analysis.model.LinguisticBundle;
import com.coherenceai.domain.analysis.model.NamedEntity;
import com.coherenceai.domain.analysis.model.Relationship;
import com.coherenceai.domain.analysis.model.TokenFeature;
import com.coherenceai.domain.compliance.model.ComplianceResult;
import com.coherenceai.domain.compliance.model.Finding;
import com.coherenceai.domain.compliance.model.PatternMatchCounts;
import com.coherenceai.domain.compliance.model.Rule;
import com.coherenceai.domain.compliance.model.RuleKind;
import com.coherenceai.domain.compliance.model.RuleSet;
import com.coherenceai.domain.compliance.model.Severity;
import com.coherenceai.infrastructure.engine.morphology.MorphologicalMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Evaluates a {@link RuleSet} against one text's linguistic and emotional features.
 * <p>
 * Each rule is checked independently, in rule-set order, with one pass over the features.
 * Findings are reported in rule order and then in scan order, so the same input always yields
 * the same result. The text is compliant iff no VIOLATION finding was produced.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleEngine {

    // Dependency labels that mark a grammatical subject
    private static final Set<String> SUBJECT_DEPS = Set.of("nsubj", "nsubjpass", "csubj", "expl");

    private static final Set<String> SENTENCE_END = Set.of(".", "!", "?");

    private final MorphologicalMatcher matcher;

    public ComplianceResult evaluate(AnalysisRequest request, RuleSet ruleSet) {
        return evaluate(request.bundle(), request.entities(), request.concepts(),
                request.relationships(), request.emotions(), ruleSet);
    }

    /**
     * Evaluate every rule of the rule set.
     *
     * @param bundle        token/POS/lemma statistics
     * @param entities      named entities (not scanned by any rule today; part of the input contract)
     * @param concepts      extracted concepts, scanned by lemma
     * @param relationships subject-predicate-object triples
     * @param emotions      emotion scores
     * @param ruleSet       rules in reporting order
     * @return the compliance verdict
     */
    public ComplianceResult evaluate(LinguisticBundle bundle,
                                     List<NamedEntity> entities,
                                     List<Concept> concepts,
                                     List<Relationship> relationships,
                                     EmotionVector emotions,
                                     RuleSet ruleSet) {
        Evaluation evaluation = new Evaluation(lemmaCandidates(bundle, concepts, relationships));

        List<Rule> rules = ruleSet.rules();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            int matched = switch (rule.kind()) {
                case PROHIBITED_CONCEPT -> checkProhibitedConcept((Rule.ProhibitedConcept) rule, evaluation);
                case REQUIRED_VIRTUE -> checkRequiredVirtue((Rule.RequiredVirtue) rule, evaluation);
                case EMOTION_THRESHOLD -> checkEmotionThreshold((Rule.EmotionThreshold) rule, emotions, evaluation);
                case EMOTION_COMBINATION -> checkEmotionCombination((Rule.EmotionCombination) rule, emotions, evaluation);
                case RELATIONSHIP_PATTERN -> checkRelationshipPattern((Rule.RelationshipPattern) rule, relationships, evaluation);
                case COMMAND_PATTERN -> checkCommandPattern((Rule.CommandPattern) rule, bundle.tokens(), evaluation);
            };
            if (matched > 0) {
                log.debug("Rule #{} {} matched {} time(s)", i, rule.kind(), matched);
            }
        }

        ComplianceResult result = ComplianceResult.of(
                evaluation.violations, evaluation.warnings, evaluation.requiredValuesPresent,
                new PatternMatchCounts(evaluation.ethicalMatches, evaluation.harmMatches, evaluation.commandMatches));

        if (!result.findings().isEmpty()) {
            log.info("Compliance evaluated: compliant={}, {} violations, {} warnings",
                    result.compliant(), result.violations().size(), result.warnings().size());
        }
        return result;
    }

    // ===== Rule checks =====

    private int checkProhibitedConcept(Rule.ProhibitedConcept rule, Evaluation evaluation) {
        Set<String> reported = new HashSet<>();
        for (LemmaCandidate candidate : evaluation.candidates) {
            for (String prohibited : rule.lemmas()) {
                if (matcher.matches(candidate.lemma(), prohibited)
                        && reported.add(pairKey(candidate.lemma(), prohibited))) {
                    evaluation.harmMatches++;
                    evaluation.add(new Finding(RuleKind.PROHIBITED_CONCEPT, Severity.VIOLATION,
                            candidate.lemma(), prohibited,
                            String.format("Prohibited concept '%s' matched '%s' in %s",
                                    prohibited, candidate.lemma(), candidate.source())));
                }
            }
        }
        return reported.size();
    }

    private int checkRequiredVirtue(Rule.RequiredVirtue rule, Evaluation evaluation) {
        Set<String> counted = new HashSet<>();
        for (LemmaCandidate candidate : evaluation.candidates) {
            for (String virtue : rule.lemmas()) {
                if (matcher.matches(candidate.lemma(), virtue) && counted.add(pairKey(candidate.lemma(), virtue))) {
                    evaluation.ethicalMatches++;
                    evaluation.requiredValuesPresent.add(virtue);
                }
            }
        }
        return counted.size();
    }

    private int checkEmotionThreshold(Rule.EmotionThreshold rule, EmotionVector emotions, Evaluation evaluation) {
        double score = emotions.scoreOf(rule.emotion());
        // Strictly greater: a score equal to the threshold does not fire
        if (!(score > rule.threshold())) {
            return 0;
        }
        evaluation.add(new Finding(RuleKind.EMOTION_THRESHOLD, rule.severity(),
                rule.emotion(), rule.emotion(),
                String.format(Locale.ROOT, "Emotion '%s' score %.3f exceeds threshold %.3f",
                        rule.emotion(), score, rule.threshold())));
        return 1;
    }

    private int checkEmotionCombination(Rule.EmotionCombination rule, EmotionVector emotions, Evaluation evaluation) {
        if (rule.emotions().isEmpty()) {
            return 0;
        }
        for (String emotion : rule.emotions()) {
            if (!(emotions.scoreOf(emotion) > rule.jointThreshold())) {
                return 0;
            }
        }
        String combined = String.join("+", rule.emotions());
        evaluation.add(new Finding(RuleKind.EMOTION_COMBINATION, rule.severity(),
                combined, combined,
                String.format(Locale.ROOT, "Emotions %s all exceed joint threshold %.3f",
                        rule.emotions(), rule.jointThreshold())));
        return 1;
    }

    private int checkRelationshipPattern(Rule.RelationshipPattern rule, List<Relationship> relationships,
                                         Evaluation evaluation) {
        int matched = 0;
        for (Relationship relationship : relationships) {
            for (String predicate : rule.predicateLemmas()) {
                if (matcher.matches(relationship.predicateLemma(), predicate)) {
                    matched++;
                    evaluation.harmMatches++;
                    evaluation.add(new Finding(RuleKind.RELATIONSHIP_PATTERN, rule.severity(),
                            relationship.subject() + " " + relationship.predicate() + " " + relationship.object(),
                            predicate,
                            String.format("Relationship '%s' -[%s]-> '%s' matches predicate '%s'",
                                    relationship.subject(), relationship.predicateLemma(),
                                    relationship.object(), predicate)));
                    break;
                }
            }
        }
        return matched;
    }

    private int checkCommandPattern(Rule.CommandPattern rule, List<TokenFeature> tokens, Evaluation evaluation) {
        List<Set<String>> pattern = rule.alternatives();
        if (pattern.isEmpty() || tokens.size() < pattern.size()) {
            return 0;
        }
        boolean[] subjectBefore = subjectBeforeInSentence(tokens);

        int matched = 0;
        int start = 0;
        while (start <= tokens.size() - pattern.size()) {
            if (subjectBefore[start] || !matchesAt(tokens, start, pattern)) {
                start++;
                continue;
            }
            List<TokenFeature> span = tokens.subList(start, start + pattern.size());
            String text = String.join(" ", span.stream().map(TokenFeature::text).toList());
            matched++;
            evaluation.commandMatches++;
            evaluation.add(new Finding(RuleKind.COMMAND_PATTERN, rule.severity(),
                    text, nullToEmpty(span.get(0).lemma()),
                    String.format("Imperative pattern %s matched '%s'", rule.posSequence(), text)));
            // Matches do not overlap
            start += pattern.size();
        }
        return matched;
    }

    // ===== Helpers =====

    private List<LemmaCandidate> lemmaCandidates(LinguisticBundle bundle, List<Concept> concepts,
                                                 List<Relationship> relationships) {
        List<LemmaCandidate> candidates = new ArrayList<>();
        for (String lemma : bundle.keyLemmas()) {
            addCandidate(candidates, lemma, "key lemmas");
        }
        for (Concept concept : concepts) {
            addCandidate(candidates, concept.lemma(), "concept '" + concept.name() + "'");
        }
        for (Relationship relationship : relationships) {
            addCandidate(candidates, relationship.predicateLemma(), "relationship predicate");
            addCandidate(candidates, relationship.object(), "relationship object");
        }
        return candidates;
    }

    private void addCandidate(List<LemmaCandidate> candidates, String lemma, String source) {
        if (lemma != null && !lemma.isBlank()) {
            candidates.add(new LemmaCandidate(lemma.strip(), source));
        }
    }

    private boolean matchesAt(List<TokenFeature> tokens, int start, List<Set<String>> pattern) {
        for (int i = 0; i < pattern.size(); i++) {
            String pos = tokens.get(start + i).pos();
            if (pos == null || !pattern.get(i).contains(pos.toUpperCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }

    /**
     * For each token, whether a subject token occurs earlier in the same sentence.
     */
    private boolean[] subjectBeforeInSentence(List<TokenFeature> tokens) {
        boolean[] subjectBefore = new boolean[tokens.size()];
        boolean seen = false;
        for (int i = 0; i < tokens.size(); i++) {
            TokenFeature token = tokens.get(i);
            subjectBefore[i] = seen;
            if (token.dep() != null && SUBJECT_DEPS.contains(token.dep().toLowerCase(Locale.ROOT))) {
                seen = true;
            }
            if ("PUNCT".equalsIgnoreCase(token.pos()) && SENTENCE_END.contains(token.text())) {
                seen = false;
            }
        }
        return subjectBefore;
    }

    private static String pairKey(String candidate, String configured) {
        return candidate.toLowerCase(Locale.ROOT) + '\u0000' + configured.toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record LemmaCandidate(String lemma, String source) {}

    /**
     * Mutable accumulator for one evaluate() call; never shared between calls.
     */
    private static final class Evaluation {
        private final List<LemmaCandidate> candidates;
        private final List<Finding> violations = new ArrayList<>();
        private final List<Finding> warnings = new ArrayList<>();
        private final Set<String> requiredValuesPresent = new LinkedHashSet<>();
        private int ethicalMatches;
        private int harmMatches;
        private int commandMatches;

        private Evaluation(List<LemmaCandidate> candidates) {
            this.candidates = candidates;
        }

        private void add(Finding finding) {
            if (finding.severity() == Severity.VIOLATION) {
                violations.add(finding);
            } else {
                warnings.add(finding);
            }
        }
    }
}
