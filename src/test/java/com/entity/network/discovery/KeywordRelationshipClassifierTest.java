package com.entity.network.discovery;

import com.entity.network.core.model.RelationshipType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeywordRelationshipClassifier")
class KeywordRelationshipClassifierTest {

    private final KeywordRelationshipClassifier classifier = new KeywordRelationshipClassifier();

    @Test
    @DisplayName("Should pick the category with the most hits")
    void testMostHits() {
        Classification result = classifier.classify(List.of(
                "The ministry funds the program",
                "A foundation sponsors the event and criticizes the plan",
                "Investors said the bank finances it"));
        assertEquals(RelationshipType.FUNDS, result.type());
        assertEquals(3, result.hits());
    }

    @Test
    @DisplayName("Should match case-insensitively on word boundaries")
    void testWordBoundaries() {
        assertEquals(RelationshipType.OPPOSES, classifier.classify(List.of("She OPPOSES the bill")).type());
        assertEquals(RelationshipType.ASSOCIATED_WITH,
                classifier.classify(List.of("Refunds were issued")).type());
    }

    @Test
    @DisplayName("Ties go to the category listed first")
    void testTieBreak() {
        Classification result = classifier.classify(List.of("He supports and opposes it"));
        assertEquals(RelationshipType.SUPPORTS, result.type());
        assertEquals(1, result.hits());
    }

    @Test
    @DisplayName("No hits yields the generic type")
    void testGeneric() {
        Classification result = classifier.classify(Arrays.asList("Nothing to see", "", null));
        assertEquals(RelationshipType.ASSOCIATED_WITH, result.type());
        assertEquals(0, result.hits());
    }

    @Test
    @DisplayName("Should accept custom indicators")
    void testCustomIndicators() {
        Map<RelationshipType, List<String>> indicators = new LinkedHashMap<>();
        indicators.put(RelationshipType.REGULATES, List.of("audits"));
        KeywordRelationshipClassifier custom = new KeywordRelationshipClassifier(indicators);
        assertEquals(RelationshipType.REGULATES, custom.classify(List.of("The agency audits banks")).type());
        assertEquals(RelationshipType.ASSOCIATED_WITH, custom.classify(List.of("It funds banks")).type());
    }
}
