package com.phillippitts.vani.domain;

/**
 * Priority tiers used when several intents match the same utterance.
 * Declaration order is the priority order: earlier tiers win.
 */
public enum IntentTier {
    CONTROL,
    VISION,
    WEBSITE,
    APPLICATION,
    SYSTEM,
    INFORMATION,
    FALLBACK
}
