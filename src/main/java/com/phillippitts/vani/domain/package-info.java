/**
 * Immutable domain model for a single assistant turn and the context carried across turns.
 *
 * <p>Per-turn values ({@link com.phillippitts.vani.domain.Utterance},
 * {@link com.phillippitts.vani.domain.ParsedCommand}) are discarded after dispatch. Only the
 * textual content folded into {@link com.phillippitts.vani.domain.ConversationTurn},
 * {@link com.phillippitts.vani.domain.VisionContext} and
 * {@link com.phillippitts.vani.domain.SearchContext} outlives a turn.
 *
 * @since 1.0
 */
package com.phillippitts.vani.domain;
