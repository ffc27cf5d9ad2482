package com.entity.network.discovery;

import com.entity.network.core.model.RelationshipType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword indicator classifier. Each category has a list of indicator phrases;
 * a hit is one phrase found in one text, matched case-insensitively on word
 * boundaries. The category with the most hits wins; ties go to the category
 * listed first. No hits yields {@link RelationshipType#ASSOCIATED_WITH}.
 */
public class KeywordRelationshipClassifier implements RelationshipClassifier {

    private static final Map<RelationshipType, List<String>> DEFAULT_INDICATORS = defaultIndicators();

    private final Map<RelationshipType, List<Pattern>> patterns;

    public KeywordRelationshipClassifier() {
        this(DEFAULT_INDICATORS);
    }

    /**
     * @param indicators phrases per type; iteration order is the tie-break priority
     */
    public KeywordRelationshipClassifier(Map<RelationshipType, List<String>> indicators) {
        this.patterns = new LinkedHashMap<>();
        indicators.forEach((type, phrases) -> patterns.put(type, phrases.stream()
                .map(phrase -> Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b", Pattern.CASE_INSENSITIVE))
                .toList()));
    }

    private static Map<RelationshipType, List<String>> defaultIndicators() {
        Map<RelationshipType, List<String>> indicators = new LinkedHashMap<>();
        indicators.put(RelationshipType.SUPPORTS,
                List.of("supports", "endorses", "backs", "advocates for", "champions"));
        indicators.put(RelationshipType.OPPOSES,
                List.of("opposes", "criticizes", "attacks", "condemns", "rejects"));
        indicators.put(RelationshipType.COLLABORATES_WITH,
                List.of("works with", "partners with", "collaborates", "together with", "alongside"));
        indicators.put(RelationshipType.LEADS,
                List.of("leads", "heads", "directs", "manages", "runs"));
        indicators.put(RelationshipType.FUNDS,
                List.of("funds", "finances", "invests in", "sponsors", "pays"));
        indicators.put(RelationshipType.PART_OF,
                List.of("member of", "part of", "belongs to", "works for", "employed by"));
        indicators.put(RelationshipType.IMPACTS,
                List.of("affects", "impacts", "influences", "changes"));
        indicators.put(RelationshipType.REGULATES,
                List.of("regulates", "oversees", "sanctions", "fines"));
        indicators.put(RelationshipType.IMPLEMENTS,
                List.of("implements", "enforces", "rolls out", "carries out"));
        indicators.put(RelationshipType.RESPONDS_TO,
                List.of("responds to", "reacts to", "in response to", "retaliates against"));
        return Collections.unmodifiableMap(indicators);
    }

    @Override
    public Classification classify(List<String> texts) {
        RelationshipType best = null;
        int bestHits = 0;
        for (Map.Entry<RelationshipType, List<Pattern>> entry : patterns.entrySet()) {
            int hits = 0;
            for (String text : texts) {
                if (text == null || text.isEmpty()) {
                    continue;
                }
                for (Pattern pattern : entry.getValue()) {
                    if (pattern.matcher(text).find()) {
                        hits++;
                    }
                }
            }
            if (hits > bestHits) {
                best = entry.getKey();
                bestHits = hits;
            }
        }
        return best == null ? Classification.generic() : new Classification(best, bestHits);
    }
}
