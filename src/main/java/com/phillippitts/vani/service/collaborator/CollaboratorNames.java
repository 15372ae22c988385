package com.phillippitts.vani.service.collaborator;

/**
 * Collaborator identifiers used in exceptions, events and metric tags.
 */
public final class CollaboratorNames {

    public static final String CONVERSATION_MODEL = "conversation-model";
    public static final String VISION_MODEL = "vision-model";
    public static final String CAMERA = "camera";
    public static final String MICROPHONE = "microphone";
    public static final String KNOWLEDGE = "knowledge";
    public static final String WEB_SEARCH = "web-search";
    public static final String DESKTOP = "desktop";
    public static final String SPEECH_TO_TEXT = "speech-to-text";
    public static final String TEXT_TO_SPEECH = "text-to-speech";

    private CollaboratorNames() {
    }
}
