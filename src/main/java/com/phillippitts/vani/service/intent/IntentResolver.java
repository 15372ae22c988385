package com.phillippitts.vani.service.intent;

import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.exception.UnresolvableIntentException;

import java.util.List;

/**
 * Selects exactly one intent for a normalized utterance.
 *
 * <p>Implementations must be deterministic and side-effect free: the same (text, language)
 * always yields the same intent.
 */
public interface IntentResolver {

    /**
     * Resolves the winning intent, falling back to {@link Intent#CONVERSATION} when no trigger
     * matches.
     *
     * @param normalizedText text produced by the language normalizer
     * @param language       detected language; only that language's triggers are evaluated
     * @return winning intent, never null
     */
    Intent resolve(String normalizedText, Language language);

    /**
     * Returns every trigger match, best first.
     *
     * @return matches sorted by priority tier, span length, then intent order; empty if none
     */
    List<RuleMatch> rankedMatches(String normalizedText, Language language);

    /**
     * Like {@link #resolve} but without the conversation fallback.
     *
     * @throws UnresolvableIntentException if no trigger matches
     */
    default Intent resolveStrict(String normalizedText, Language language) {
        List<RuleMatch> matches = rankedMatches(normalizedText, language);
        if (matches.isEmpty()) {
            throw new UnresolvableIntentException(normalizedText, language);
        }
        return matches.get(0).intent();
    }
}
