package com.phillippitts.vani.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Last visual description produced by the vision model.
 *
 * @param description description text returned for the last captured frame
 * @param capturedAt  when the frame was described
 * @param ownerTurn   index of the user turn that produced (or last referenced) the description
 * @param age         committed user turns since {@code ownerTurn}; never negative
 */
public record VisionContext(String description, Instant capturedAt, long ownerTurn, long age) {

    public VisionContext {
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
        if (ownerTurn < 0) {
            throw new IllegalArgumentException("ownerTurn must be >= 0, got: " + ownerTurn);
        }
        if (age < 0) {
            throw new IllegalArgumentException("age must be >= 0, got: " + age);
        }
    }
}
