package com.phillippitts.vani.domain;

/** How a turn resolved. Every turn produces a response, whatever its status. */
public enum TurnStatus {
    OK,
    EMPTY_UTTERANCE,
    MISSING_PARAMETER,
    STALE_CONTEXT,
    NOT_FOUND,
    COLLABORATOR_UNAVAILABLE,
    COLLABORATOR_TIMEOUT,
    DESKTOP_ACTION_FAILED,
    RESOURCE_BUSY,
    CANCELLED
}
