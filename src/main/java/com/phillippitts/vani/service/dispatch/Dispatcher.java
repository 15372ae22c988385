package com.phillippitts.vani.service.dispatch;

import com.phillippitts.vani.domain.ExtractionResult;
import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.domain.ParsedCommand;
import com.phillippitts.vani.domain.TurnResponse;
import com.phillippitts.vani.exception.MissingParameterException;
import com.phillippitts.vani.service.context.ContextStore;

/**
 * Executes a parsed command against its collaborator and records the outcome in the
 * {@link ContextStore}.
 *
 * <p>Implementations never throw for collaborator failures: every failure resolves to a
 * {@link TurnResponse} whose status says what went wrong, and leaves the context store as it
 * was before the turn.
 */
public interface Dispatcher {

    /**
     * @param command complete command produced by the parameter extractor
     * @param context session memory; written only when the turn succeeds
     * @return localized response plus a side-effect description
     */
    TurnResponse dispatch(ParsedCommand command, ContextStore context);

    /**
     * Handles an incomplete extraction without calling any collaborator: asks the user for the
     * first missing slot.
     */
    TurnResponse clarify(ExtractionResult incomplete, Language language);

    /**
     * Convenience entry for either extraction outcome.
     */
    default TurnResponse dispatch(ExtractionResult extraction, Language language, ContextStore context) {
        ParsedCommand command;
        try {
            command = extraction.requireCommand();
        } catch (MissingParameterException e) {
            return clarify(extraction, language);
        }
        return dispatch(command, context);
    }
}
