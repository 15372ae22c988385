package com.phillippitts.vani.domain;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An intent with every slot its schema requires, plus any optional slots found in the text.
 *
 * @param intent   winning intent
 * @param slots    slot name to extracted value; absent slots are simply missing from the map
 * @param text     normalized utterance text the command was extracted from
 * @param language language of the utterance
 */
public record ParsedCommand(Intent intent, Map<String, String> slots, String text, Language language) {

    public ParsedCommand {
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(language, "language must not be null");
        slots = slots == null ? Map.of() : Map.copyOf(slots);
        for (String required : intent.requiredSlots()) {
            if (!slots.containsKey(required)) {
                throw new IllegalArgumentException(
                        "Intent " + intent + " requires slot '" + required + "'");
            }
        }
    }

    public Optional<String> slot(String name) {
        return Optional.ofNullable(slots.get(name));
    }

    /**
     * Required slot accessor; the constructor guarantees presence for schema slots.
     */
    public String require(String name) {
        String value = slots.get(name);
        if (value == null) {
            throw new IllegalStateException("Slot '" + name + "' missing for " + intent);
        }
        return value;
    }
}
