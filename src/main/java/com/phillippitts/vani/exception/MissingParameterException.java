package com.phillippitts.vani.exception;

import com.phillippitts.vani.domain.Intent;

import java.util.List;

/**
 * Thrown when a command is requested for an intent whose required slots were not found.
 */
public class MissingParameterException extends VaniException {

    private final Intent intent;
    private final List<String> slots;

    public MissingParameterException(Intent intent, List<String> slots) {
        super("Missing parameter(s) " + slots + " for intent " + intent);
        this.intent = intent;
        this.slots = List.copyOf(slots);
    }

    public Intent getIntent() {
        return intent;
    }

    public List<String> getSlots() {
        return slots;
    }
}
