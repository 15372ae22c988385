package com.phillippitts.vani.domain;

import java.util.Locale;
import java.util.Optional;

/** Volume change requested by the user. */
public enum VolumeDirection {
    UP,
    DOWN,
    MUTE;

    /** Slot value as stored in a {@link ParsedCommand} ("up", "down", "mute"). */
    public String slotValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<VolumeDirection> fromSlot(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (VolumeDirection direction : values()) {
            if (direction.slotValue().equals(value)) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }
}
