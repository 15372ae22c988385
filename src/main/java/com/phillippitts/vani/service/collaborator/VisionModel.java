package com.phillippitts.vani.service.collaborator;

/**
 * Visual question answering over a captured frame.
 */
public interface VisionModel {

    /**
     * @param frame    frame to describe
     * @param question question derived from the user's utterance
     * @return description text (English)
     */
    String describe(ImageFrame frame, String question);
}
