package com.phillippitts.vani.service.collaborator;

import com.phillippitts.vani.domain.Language;

import java.util.Optional;

/**
 * Encyclopedic lookup (Wikipedia in the reference deployment).
 */
public interface KnowledgeLookup {

    /**
     * @param query    search topic with command words already stripped
     * @param language preferred article language
     * @return short factual snippet, or empty when no article exists
     */
    Optional<String> lookup(String query, Language language);
}
