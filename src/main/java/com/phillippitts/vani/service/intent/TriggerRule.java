package com.phillippitts.vani.service.intent;

import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.Language;

import java.util.Objects;

/**
 * One row of the trigger table.
 *
 * @param language  language whose utterances the rule applies to
 * @param intent    intent activated when the pattern occurs
 * @param pattern   compiled trigger phrase
 * @param command   true for command words ("search for", "tell me about") that are stripped when
 *                  the utterance is turned into a query; false for content keywords ("weather")
 * @param catchAll  true for open-ended verb phrases ("open &lt;target&gt;") that only win when no
 *                  other rule of the utterance matched
 */
public record TriggerRule(Language language, Intent intent, TriggerPattern pattern, boolean command,
                          boolean catchAll) {

    public TriggerRule(Language language, Intent intent, TriggerPattern pattern, boolean command) {
        this(language, intent, pattern, command, false);
    }

    public TriggerRule {
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        if (intent == Intent.CONVERSATION) {
            throw new IllegalArgumentException("Conversation is the default intent and takes no triggers");
        }
    }
}
