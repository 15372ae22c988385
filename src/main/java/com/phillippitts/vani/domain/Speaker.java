package com.phillippitts.vani.domain;

/** Who produced a conversation turn. */
public enum Speaker {
    USER,
    ASSISTANT
}
