package com.flowsmith.core.grounding;

import com.flowsmith.core.model.DataSourceMetadata.FieldDescriptor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves a semantic field name ("customer email") to an actual field of a
 * data source through an ordered ladder, each tier short-circuiting the next:
 * <ol>
 *   <li>exact name, 1.0</li>
 *   <li>case-insensitive name, 0.95</li>
 *   <li>separator-normalised name, 0.9</li>
 *   <li>keyword score against field descriptions, accepted at {@code descriptionMinScore}</li>
 *   <li>normalised edit-distance similarity, accepted at {@code minSimilarity}</li>
 * </ol>
 * Stateless.
 */
@Component
public class FieldMatcher {

    private static final double CASE_INSENSITIVE_CONFIDENCE = 0.95;
    private static final double NORMALIZED_CONFIDENCE = 0.9;
    private static final double KEYWORD_SCORE = 0.3;
    private static final double DIRECTIVE_BONUS = 0.2;
    private static final double PHRASE_BONUS = 0.5;

    /**
     * Matches against fields that may carry descriptions. Preferred over
     * {@link #matchField} whenever a connector supplies descriptions.
     */
    public FieldMatch matchFieldWithDescriptions(String semanticName, List<FieldDescriptor> fields, MatchOptions options) {
        List<String> names = fields.stream().map(FieldDescriptor::name).toList();
        FieldMatch byName = matchByName(semanticName, names);
        if (byName != null) {
            return byName;
        }

        FieldMatch byDescription = matchByDescription(semanticName, fields, options);
        if (byDescription != null) {
            return byDescription;
        }

        return matchFuzzy(semanticName, names, options);
    }

    /**
     * Name-only matching, for connectors that report bare headers.
     */
    public FieldMatch matchField(String semanticName, List<String> fields, MatchOptions options) {
        FieldMatch byName = matchByName(semanticName, fields);
        if (byName != null) {
            return byName;
        }
        return matchFuzzy(semanticName, fields, options);
    }

    /**
     * Runs the ladder for each synonym and returns the globally best match.
     * When nothing matches, the alternatives are the closest fuzzy
     * candidates pooled across all synonyms.
     */
    public FieldMatch matchMultipleCandidates(List<String> candidates, List<String> fields, MatchOptions options) {
        FieldMatch best = null;
        List<FieldMatch.Candidate> matchedNames = new ArrayList<>();
        for (String candidate : candidates) {
            FieldMatch result = matchField(candidate, fields, options);
            if (!result.matched()) {
                continue;
            }
            matchedNames.add(new FieldMatch.Candidate(result.actualFieldName(), result.confidence()));
            if (best == null || result.isStrongerThan(best)) {
                best = result;
            }
        }
        if (best != null) {
            List<FieldMatch.Candidate> ranked = matchedNames.stream()
                    .sorted(Comparator.comparingDouble(FieldMatch.Candidate::score).reversed())
                    .limit(options.maxCandidates())
                    .toList();
            return new FieldMatch(true, best.actualFieldName(), best.confidence(), best.method(), ranked);
        }
        return FieldMatch.none(pooledAlternatives(candidates, fields, options));
    }

    /**
     * Like {@link #matchMultipleCandidates} but against described fields.
     */
    public FieldMatch matchMultipleCandidatesWithDescriptions(List<String> candidates, List<FieldDescriptor> fields,
                                                              MatchOptions options) {
        FieldMatch best = null;
        for (String candidate : candidates) {
            FieldMatch result = matchFieldWithDescriptions(candidate, fields, options);
            if (result.matched() && (best == null || result.isStrongerThan(best))) {
                best = result;
            }
        }
        if (best != null) {
            return best;
        }
        List<String> names = fields.stream().map(FieldDescriptor::name).toList();
        return FieldMatch.none(pooledAlternatives(candidates, names, options));
    }

    private FieldMatch matchByName(String semanticName, List<String> fields) {
        for (String field : fields) {
            if (field.equals(semanticName)) {
                return FieldMatch.of(field, 1.0, MatchMethod.EXACT);
            }
        }
        for (String field : fields) {
            if (field.equalsIgnoreCase(semanticName)) {
                return FieldMatch.of(field, CASE_INSENSITIVE_CONFIDENCE, MatchMethod.CASE_INSENSITIVE);
            }
        }
        String normalized = normalize(semanticName);
        for (String field : fields) {
            if (normalize(field).equals(normalized)) {
                return FieldMatch.of(field, NORMALIZED_CONFIDENCE, MatchMethod.NORMALIZED);
            }
        }
        return null;
    }

    private FieldMatch matchByDescription(String semanticName, List<FieldDescriptor> fields, MatchOptions options) {
        String normalizedSemantic = normalize(semanticName);
        List<String> keywords = new ArrayList<>();
        for (String token : normalizedSemantic.split("_")) {
            if (token.length() > 2) {
                keywords.add(token);
            }
        }

        List<FieldMatch.Candidate> scored = new ArrayList<>();
        for (FieldDescriptor field : fields) {
            if (field.description() == null || field.description().isBlank()) {
                continue;
            }
            String description = normalize(field.description());
            double score = 0.0;
            for (String keyword : keywords) {
                if (description.contains(keyword)) {
                    score += KEYWORD_SCORE;
                }
            }
            if (description.contains("use_this") || description.contains("use_for")) {
                score += DIRECTIVE_BONUS;
            }
            if (description.contains(normalizedSemantic)) {
                score += PHRASE_BONUS;
            }
            if (score > 0) {
                scored.add(new FieldMatch.Candidate(field.name(), Math.min(score, 1.0)));
            }
        }
        if (scored.isEmpty()) {
            return null;
        }
        // stable sort keeps field order among equal scores
        scored.sort(Comparator.comparingDouble(FieldMatch.Candidate::score).reversed());
        FieldMatch.Candidate best = scored.get(0);
        if (best.score() < options.descriptionMinScore()) {
            return null;
        }
        return new FieldMatch(true, best.fieldName(), best.score(), MatchMethod.DESCRIPTION,
                scored.subList(0, Math.min(options.maxCandidates(), scored.size())));
    }

    private FieldMatch matchFuzzy(String semanticName, List<String> fields, MatchOptions options) {
        List<FieldMatch.Candidate> ranked = rankBySimilarity(semanticName, fields);
        List<FieldMatch.Candidate> top = ranked.subList(0, Math.min(options.maxCandidates(), ranked.size()));
        if (!ranked.isEmpty() && ranked.get(0).score() >= options.minSimilarity()) {
            FieldMatch.Candidate best = ranked.get(0);
            List<FieldMatch.Candidate> accepted = top.stream()
                    .filter(c -> c.score() >= options.minSimilarity())
                    .toList();
            return new FieldMatch(true, best.fieldName(), best.score(), MatchMethod.FUZZY, accepted);
        }
        return FieldMatch.none(top);
    }

    private List<FieldMatch.Candidate> pooledAlternatives(List<String> candidates, List<String> fields, MatchOptions options) {
        Map<String, Double> bestByField = new LinkedHashMap<>();
        for (String candidate : candidates) {
            for (FieldMatch.Candidate c : rankBySimilarity(candidate, fields)) {
                bestByField.merge(c.fieldName(), c.score(), Math::max);
            }
        }
        return bestByField.entrySet().stream()
                .map(e -> new FieldMatch.Candidate(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingDouble(FieldMatch.Candidate::score).reversed())
                .limit(options.maxCandidates())
                .toList();
    }

    private List<FieldMatch.Candidate> rankBySimilarity(String semanticName, List<String> fields) {
        String normalizedSemantic = normalize(semanticName);
        List<FieldMatch.Candidate> ranked = new ArrayList<>();
        for (String field : fields) {
            ranked.add(new FieldMatch.Candidate(field, similarity(normalizedSemantic, normalize(field))));
        }
        ranked.sort(Comparator.comparingDouble(FieldMatch.Candidate::score).reversed());
        return ranked;
    }

    /**
     * Lowercases, trims and collapses runs of spaces, underscores and hyphens to one underscore.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT).trim().replaceAll("[\\s_-]+", "_");
    }

    /**
     * {@code 1 - distance / max(len)}; 1.0 for two empty strings.
     */
    static double similarity(String a, String b) {
        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / maxLength;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
