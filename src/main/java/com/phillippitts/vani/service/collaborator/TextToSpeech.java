package com.phillippitts.vani.service.collaborator;

import com.phillippitts.vani.domain.Language;

/**
 * Speech synthesis and playback. Blocks until playback ends; callers run it off the turn thread.
 */
public interface TextToSpeech {

    void speak(String text, Language language);
}
