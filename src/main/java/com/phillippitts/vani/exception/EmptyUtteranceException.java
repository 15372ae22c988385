package com.phillippitts.vani.exception;

/**
 * Thrown by strict entry points when the transcript is empty or whitespace-only.
 * The per-turn function never throws it; it answers with a re-prompt instead.
 */
public class EmptyUtteranceException extends VaniException {

    public EmptyUtteranceException() {
        super("Utterance is empty");
    }
}
