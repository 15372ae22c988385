package com.phillippitts.vani.service.collaborator;

import java.util.Objects;

/**
 * Recorded PCM audio (16-bit little-endian mono).
 */
public record AudioClip(byte[] pcm, int sampleRate) {

    public AudioClip {
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be > 0, got: " + sampleRate);
        }
    }

    public boolean isEmpty() {
        return pcm.length == 0;
    }
}
