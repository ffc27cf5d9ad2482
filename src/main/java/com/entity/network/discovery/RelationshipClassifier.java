package com.entity.network.discovery;

import java.util.List;

/**
 * Infers a relationship type from the texts in which two entities appear together.
 */
public interface RelationshipClassifier {

    Classification classify(List<String> texts);
}
