package com.phillippitts.vani.service.collaborator;

/**
 * Records one utterance from the microphone, stopping on silence. Callers hold the microphone
 * lease for the duration of the call.
 */
public interface AudioSource {

    AudioClip record();
}
