package com.phillippitts.vani.config;

import com.phillippitts.vani.config.properties.AssistantProperties;
import com.phillippitts.vani.config.properties.ContextProperties;
import com.phillippitts.vani.config.properties.ResourceProperties;
import com.phillippitts.vani.service.collaborator.AudioSource;
import com.phillippitts.vani.service.collaborator.CameraSource;
import com.phillippitts.vani.service.collaborator.CollaboratorNames;
import com.phillippitts.vani.service.collaborator.ConversationModel;
import com.phillippitts.vani.service.collaborator.DesktopActions;
import com.phillippitts.vani.service.collaborator.KnowledgeLookup;
import com.phillippitts.vani.service.collaborator.SpeechToText;
import com.phillippitts.vani.service.collaborator.TextToSpeech;
import com.phillippitts.vani.service.collaborator.VisionModel;
import com.phillippitts.vani.service.collaborator.WebSearch;
import com.phillippitts.vani.service.context.ContextStore;
import com.phillippitts.vani.service.context.InMemoryContextStore;
import com.phillippitts.vani.service.dispatch.DefaultDispatcher;
import com.phillippitts.vani.service.dispatch.DispatchCollaborators;
import com.phillippitts.vani.service.dispatch.DispatchSettings;
import com.phillippitts.vani.service.dispatch.ResponseTemplates;
import com.phillippitts.vani.service.extract.DefaultParameterExtractor;
import com.phillippitts.vani.service.extract.ParameterExtractor;
import com.phillippitts.vani.service.intent.DefaultIntentResolver;
import com.phillippitts.vani.service.intent.DefaultTriggerRules;
import com.phillippitts.vani.service.intent.EntityCatalog;
import com.phillippitts.vani.service.intent.IntentResolver;
import com.phillippitts.vani.service.intent.TriggerRuleTable;
import com.phillippitts.vani.service.language.LanguageNormalizer;
import com.phillippitts.vani.service.metrics.TurnMetricsPublisher;
import com.phillippitts.vani.service.resource.ExclusiveResource;
import com.phillippitts.vani.service.turn.AssistantTurnService;
import com.phillippitts.vani.service.turn.DefaultAssistantTurnService;
import com.phillippitts.vani.service.turn.VoiceSession;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the utterance pipeline: normalizer, rule table, resolver, extractor, context store,
 * dispatcher and the turn service on top of them.
 *
 * <p>Every component is a plain object built here; none of them depends on Spring, so the
 * unit tests construct them directly.
 */
@Configuration
public class AssistantConfig {

    private final AssistantProperties assistantProperties;
    private final ContextProperties contextProperties;
    private final ResourceProperties resourceProperties;
    private final ApplicationEventPublisher publisher;
    private final TurnMetricsPublisher metricsPublisher;

    public AssistantConfig(AssistantProperties assistantProperties,
                           ContextProperties contextProperties,
                           ResourceProperties resourceProperties,
                           ApplicationEventPublisher publisher,
                           TurnMetricsPublisher metricsPublisher) {
        this.assistantProperties = assistantProperties;
        this.contextProperties = contextProperties;
        this.resourceProperties = resourceProperties;
        this.publisher = publisher;
        this.metricsPublisher = metricsPublisher;
    }

    @Bean
    public LanguageNormalizer languageNormalizer() {
        return new LanguageNormalizer();
    }

    @Bean
    public EntityCatalog entityCatalog() {
        return EntityCatalog.defaults();
    }

    @Bean
    public TriggerRuleTable triggerRuleTable(EntityCatalog entityCatalog) {
        return DefaultTriggerRules.create(entityCatalog);
    }

    @Bean
    public IntentResolver intentResolver(TriggerRuleTable triggerRuleTable) {
        return new DefaultIntentResolver(triggerRuleTable);
    }

    @Bean
    public ParameterExtractor parameterExtractor(TriggerRuleTable triggerRuleTable) {
        return new DefaultParameterExtractor(triggerRuleTable);
    }

    @Bean
    public ContextStore contextStore() {
        return new InMemoryContextStore(contextProperties.getHistoryCapacity(),
                contextProperties.getVisionStalenessTurns());
    }

    @Bean
    public DispatchSettings dispatchSettings() {
        return new DispatchSettings(
                assistantProperties.getName(),
                assistantProperties.getNameHi(),
                assistantProperties.getNameGu(),
                assistantProperties.getDefaultBrowser(),
                assistantProperties.isWebSearchEnabled(),
                assistantProperties.getWebSearchMaxResults(),
                contextProperties.getPromptHistorySize());
    }

    @Bean
    public ResponseTemplates responseTemplates(DispatchSettings dispatchSettings) {
        return new ResponseTemplates(dispatchSettings);
    }

    @Bean(name = "cameraResource")
    public ExclusiveResource cameraResource() {
        return new ExclusiveResource(CollaboratorNames.CAMERA, resourceProperties.getAcquireTimeoutMs());
    }

    @Bean(name = "microphoneResource")
    public ExclusiveResource microphoneResource() {
        return new ExclusiveResource(CollaboratorNames.MICROPHONE, resourceProperties.getAcquireTimeoutMs());
    }

    @Bean
    public DefaultDispatcher dispatcher(DispatchSettings dispatchSettings,
                                        ConversationModel conversationModel,
                                        VisionModel visionModel,
                                        CameraSource cameraSource,
                                        KnowledgeLookup knowledgeLookup,
                                        WebSearch webSearch,
                                        DesktopActions desktopActions,
                                        @Qualifier("cameraResource") ExclusiveResource cameraResource) {
        DispatchCollaborators collaborators = new DispatchCollaborators(
                conversationModel, visionModel, cameraSource, knowledgeLookup, webSearch, desktopActions);
        return new DefaultDispatcher(dispatchSettings, collaborators, cameraResource, publisher, metricsPublisher);
    }

    @Bean
    public AssistantTurnService assistantTurnService(LanguageNormalizer languageNormalizer,
                                                     IntentResolver intentResolver,
                                                     ParameterExtractor parameterExtractor,
                                                     DefaultDispatcher dispatcher,
                                                     ResponseTemplates responseTemplates,
                                                     ContextStore contextStore) {
        return new DefaultAssistantTurnService(languageNormalizer, intentResolver, parameterExtractor,
                dispatcher, responseTemplates, contextStore, publisher, metricsPublisher);
    }

    @Bean
    public VoiceSession voiceSession(AudioSource audioSource,
                                     SpeechToText speechToText,
                                     TextToSpeech textToSpeech,
                                     @Qualifier("microphoneResource") ExclusiveResource microphoneResource,
                                     AssistantTurnService assistantTurnService,
                                     ResponseTemplates responseTemplates,
                                     @Qualifier("speechExecutor") Executor speechExecutor) {
        return new VoiceSession(audioSource, speechToText, textToSpeech, microphoneResource,
                assistantTurnService, responseTemplates, speechExecutor);
    }

    /**
     * Starts the microphone loop on its own thread. Off by default so the REST surface can run
     * on machines without audio devices.
     */
    @Bean
    @ConditionalOnProperty(prefix = "assistant", name = "voice-loop-enabled", havingValue = "true")
    public VoiceLoopRunner voiceLoopRunner(VoiceSession voiceSession) {
        return new VoiceLoopRunner(voiceSession);
    }
}
