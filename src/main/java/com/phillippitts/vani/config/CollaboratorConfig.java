package com.phillippitts.vani.config;

import com.phillippitts.vani.service.collaborator.AudioSource;
import com.phillippitts.vani.service.collaborator.CameraSource;
import com.phillippitts.vani.service.collaborator.ConversationModel;
import com.phillippitts.vani.service.collaborator.DesktopActions;
import com.phillippitts.vani.service.collaborator.KnowledgeLookup;
import com.phillippitts.vani.service.collaborator.SpeechToText;
import com.phillippitts.vani.service.collaborator.TextToSpeech;
import com.phillippitts.vani.service.collaborator.UnconfiguredCollaborators;
import com.phillippitts.vani.service.collaborator.VisionModel;
import com.phillippitts.vani.service.collaborator.WebSearch;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback collaborators. Each one answers every call with an "unavailable" failure, which the
 * dispatcher turns into a spoken apology. Declare a bean of the same type to plug in a real
 * model, camera or desktop integration.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean
    public ConversationModel conversationModel() {
        return UnconfiguredCollaborators.conversationModel();
    }

    @Bean
    @ConditionalOnMissingBean
    public VisionModel visionModel() {
        return UnconfiguredCollaborators.visionModel();
    }

    @Bean
    @ConditionalOnMissingBean
    public CameraSource cameraSource() {
        return UnconfiguredCollaborators.cameraSource();
    }

    @Bean
    @ConditionalOnMissingBean
    public KnowledgeLookup knowledgeLookup() {
        return UnconfiguredCollaborators.knowledgeLookup();
    }

    @Bean
    @ConditionalOnMissingBean
    public WebSearch webSearch() {
        return UnconfiguredCollaborators.webSearch();
    }

    @Bean
    @ConditionalOnMissingBean
    public DesktopActions desktopActions() {
        return UnconfiguredCollaborators.desktopActions();
    }

    @Bean
    @ConditionalOnMissingBean
    public AudioSource audioSource() {
        return UnconfiguredCollaborators.audioSource();
    }

    @Bean
    @ConditionalOnMissingBean
    public SpeechToText speechToText() {
        return UnconfiguredCollaborators.speechToText();
    }

    @Bean
    @ConditionalOnMissingBean
    public TextToSpeech textToSpeech() {
        return UnconfiguredCollaborators.textToSpeech();
    }
}
