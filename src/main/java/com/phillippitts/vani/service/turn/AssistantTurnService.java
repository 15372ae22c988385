package com.phillippitts.vani.service.turn;

import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.domain.TurnResponse;
import com.phillippitts.vani.domain.Utterance;

/**
 * The per-turn function: raw transcript in, response text plus side-effect description out.
 *
 * <p>Every call produces a response; failures are reported through
 * {@link TurnResponse#status()} rather than exceptions.
 */
public interface AssistantTurnService {

    TurnResponse handle(Utterance utterance);

    /**
     * @param transcript   raw transcript
     * @param languageHint language reported by speech-to-text; nullable
     */
    default TurnResponse handle(String transcript, Language languageHint) {
        return handle(Utterance.of(transcript, languageHint));
    }
}
