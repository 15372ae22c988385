package com.phillippitts.vani.service.collaborator;

import java.time.Instant;
import java.util.Objects;

/**
 * One encoded camera frame.
 */
public record ImageFrame(byte[] data, String mimeType, Instant capturedAt) {

    public ImageFrame {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(mimeType, "mimeType must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
    }
}
