package com.phillippitts.vani.service.collaborator;

public interface SpeechToText {

    Transcript transcribe(AudioClip audio);
}
