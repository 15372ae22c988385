package com.phillippitts.vani.service.collaborator;

import com.phillippitts.vani.domain.SystemStatus;
import com.phillippitts.vani.domain.VolumeDirection;
import com.phillippitts.vani.exception.CollaboratorUnavailableException;

/**
 * Stand-ins registered when no real collaborator bean is present. Every call fails with
 * {@link CollaboratorUnavailableException}, which the dispatcher turns into a spoken error.
 */
public final class UnconfiguredCollaborators {

    private UnconfiguredCollaborators() {
    }

    public static ConversationModel conversationModel() {
        return request -> {
            throw unavailable(CollaboratorNames.CONVERSATION_MODEL);
        };
    }

    public static VisionModel visionModel() {
        return (frame, question) -> {
            throw unavailable(CollaboratorNames.VISION_MODEL);
        };
    }

    public static CameraSource cameraSource() {
        return () -> {
            throw unavailable(CollaboratorNames.CAMERA);
        };
    }

    public static KnowledgeLookup knowledgeLookup() {
        return (query, language) -> {
            throw unavailable(CollaboratorNames.KNOWLEDGE);
        };
    }

    public static WebSearch webSearch() {
        return request -> {
            throw unavailable(CollaboratorNames.WEB_SEARCH);
        };
    }

    public static SpeechToText speechToText() {
        return audio -> {
            throw unavailable(CollaboratorNames.SPEECH_TO_TEXT);
        };
    }

    public static AudioSource audioSource() {
        return () -> {
            throw unavailable(CollaboratorNames.MICROPHONE);
        };
    }

    public static TextToSpeech textToSpeech() {
        return (text, language) -> {
            throw unavailable(CollaboratorNames.TEXT_TO_SPEECH);
        };
    }

    public static DesktopActions desktopActions() {
        return new DesktopActions() {
            @Override
            public void openApplication(String application) {
                throw unavailable(CollaboratorNames.DESKTOP);
            }

            @Override
            public void closeApplication(String application) {
                throw unavailable(CollaboratorNames.DESKTOP);
            }

            @Override
            public void openWebsite(String url, String browser) {
                throw unavailable(CollaboratorNames.DESKTOP);
            }

            @Override
            public String takeScreenshot() {
                throw unavailable(CollaboratorNames.DESKTOP);
            }

            @Override
            public SystemStatus systemStatus() {
                throw unavailable(CollaboratorNames.DESKTOP);
            }

            @Override
            public void adjustVolume(VolumeDirection direction) {
                throw unavailable(CollaboratorNames.DESKTOP);
            }
        };
    }

    private static CollaboratorUnavailableException unavailable(String collaborator) {
        return new CollaboratorUnavailableException("no " + collaborator + " configured", collaborator);
    }
}
