package com.phillippitts.vani.service.collaborator;

import com.phillippitts.vani.domain.ConversationTurn;
import com.phillippitts.vani.domain.Language;

import java.util.List;
import java.util.Objects;

/**
 * Input for one {@link ConversationModel} call.
 *
 * @param prompt   fully rendered prompt: system instruction, context blocks, replayed history
 *                 and the current user line
 * @param history  the turns replayed inside {@code prompt}, oldest first
 * @param language language the reply must be written in
 */
public record ConversationRequest(String prompt, List<ConversationTurn> history, Language language) {

    public ConversationRequest {
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(language, "language must not be null");
        history = history == null ? List.of() : List.copyOf(history);
    }
}
