package com.datamodel.matching.similarity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores keyword alignment between an attribute's semantic type and a column name.
 *
 * <p>For every semantic key whose aliases occur in the semantic type, the column
 * scores 1.0 if it contains the key or an alias, 0.75 if it starts with the key,
 * and 0.5 otherwise. The best key wins; no matching key scores 0.0.</p>
 */
public class SemanticHintScorer {

    private static final Map<String, List<String>> DEFAULT_HINTS = defaultHints();

    private final Map<String, List<String>> hints;

    public SemanticHintScorer() {
        this(DEFAULT_HINTS);
    }

    public SemanticHintScorer(Map<String, List<String>> hints) {
        this.hints = new LinkedHashMap<>(hints);
    }

    public double score(String semanticType, String columnName) {
        if (semanticType == null || columnName == null || semanticType.isBlank() || columnName.isBlank()) {
            return 0.0;
        }

        String semantic = semanticType.toLowerCase(Locale.ROOT);
        String column = columnName.toLowerCase(Locale.ROOT);
        double best = 0.0;

        for (Map.Entry<String, List<String>> hint : hints.entrySet()) {
            String key = hint.getKey();
            List<String> aliases = hint.getValue();
            if (aliases.stream().noneMatch(semantic::contains)) {
                continue;
            }
            if (column.contains(key) || aliases.stream().anyMatch(column::contains)) {
                best = Math.max(best, 1.0);
            } else if (column.startsWith(key)) {
                best = Math.max(best, 0.75);
            } else {
                best = Math.max(best, 0.5);
            }
        }
        return best;
    }

    public Map<String, List<String>> getHints() {
        return Map.copyOf(hints);
    }

    private static Map<String, List<String>> defaultHints() {
        Map<String, List<String>> hints = new LinkedHashMap<>();
        hints.put("id", List.of("id", "identifier", "key"));
        hints.put("dob", List.of("dob", "birth", "birthdate", "birth_date", "date_of_birth"));
        hints.put("gender", List.of("gender", "sex"));
        hints.put("npi", List.of("npi"));
        hints.put("icd", List.of("icd"));
        hints.put("cpt", List.of("cpt"));
        hints.put("ndc", List.of("ndc"));
        return hints;
    }
}
