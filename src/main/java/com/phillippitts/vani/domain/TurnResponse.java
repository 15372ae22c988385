package com.phillippitts.vani.domain;

import java.util.Objects;

/**
 * Result of one turn: the text to speak plus a loggable description of what happened.
 *
 * @param responseText    localized text handed to speech synthesis
 * @param sideEffect      short description of the action taken (e.g. "closed firefox"); empty if none
 * @param intent          intent that handled the turn (CONVERSATION for empty utterances)
 * @param language        language the response is written in
 * @param status          outcome classification
 * @param sessionFinished true once the user asked the assistant to exit
 */
public record TurnResponse(String responseText,
                           String sideEffect,
                           Intent intent,
                           Language language,
                           TurnStatus status,
                           boolean sessionFinished) {

    public TurnResponse {
        Objects.requireNonNull(responseText, "responseText must not be null");
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(status, "status must not be null");
        sideEffect = sideEffect == null ? "" : sideEffect;
    }

    public static TurnResponse ok(String text, String sideEffect, Intent intent, Language language) {
        return new TurnResponse(text, sideEffect, intent, language, TurnStatus.OK, false);
    }

    public static TurnResponse failed(String text, Intent intent, Language language, TurnStatus status) {
        return new TurnResponse(text, "", intent, language, status, false);
    }

    public boolean isSuccess() {
        return status == TurnStatus.OK;
    }
}
