package com.phillippitts.vani.domain;

import java.util.Set;

/**
 * The capability domain selected for an utterance. Exactly one per utterance.
 *
 * <p>Each intent carries its priority tier and the slots it cannot be dispatched without.
 * Within a tier, declaration order breaks ties that span length cannot.
 */
public enum Intent {
    EXIT(IntentTier.CONTROL),
    RESET(IntentTier.CONTROL),
    IDENTITY(IntentTier.CONTROL),
    VISION(IntentTier.VISION),
    OPEN_WEBSITE(IntentTier.WEBSITE, Slots.SITE),
    OPEN_APP(IntentTier.APPLICATION, Slots.APP),
    CLOSE_APP(IntentTier.APPLICATION, Slots.APP),
    SCREENSHOT(IntentTier.SYSTEM),
    SYSTEM_STATUS(IntentTier.SYSTEM),
    VOLUME_CONTROL(IntentTier.SYSTEM, Slots.DIRECTION),
    WEB_SEARCH(IntentTier.INFORMATION, Slots.QUERY),
    KNOWLEDGE(IntentTier.INFORMATION, Slots.QUERY),
    CONVERSATION(IntentTier.FALLBACK);

    private final IntentTier tier;
    private final Set<String> requiredSlots;

    Intent(IntentTier tier, String... requiredSlots) {
        this.tier = tier;
        this.requiredSlots = Set.of(requiredSlots);
    }

    public IntentTier tier() {
        return tier;
    }

    /**
     * @return slot names a {@link ParsedCommand} for this intent must carry
     */
    public Set<String> requiredSlots() {
        return requiredSlots;
    }
}
