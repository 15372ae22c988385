package com.phillippitts.vani.service.turn;

import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.domain.TurnResponse;
import com.phillippitts.vani.domain.TurnStatus;
import com.phillippitts.vani.exception.CollaboratorException;
import com.phillippitts.vani.exception.ResourceBusyException;
import com.phillippitts.vani.exception.TurnCancelledException;
import com.phillippitts.vani.service.collaborator.AudioClip;
import com.phillippitts.vani.service.collaborator.AudioSource;
import com.phillippitts.vani.service.collaborator.SpeechToText;
import com.phillippitts.vani.service.collaborator.TextToSpeech;
import com.phillippitts.vani.service.collaborator.Transcript;
import com.phillippitts.vani.service.dispatch.ResponseTemplates;
import com.phillippitts.vani.service.resource.ExclusiveResource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Listen, transcribe, respond, speak: the voice loop around {@link AssistantTurnService}.
 *
 * <p>The microphone lease is held only while {@link AudioSource#record()} runs. Speech
 * synthesis is handed to the speech executor and never blocks the next turn.
 *
 * <p>Errors that happen before a transcript exists are answered in the language of the
 * previous turn.
 *
 * @since 1.0
 */
public final class VoiceSession {

    private static final Logger LOG = LogManager.getLogger(VoiceSession.class);

    private final AudioSource audio;
    private final SpeechToText speechToText;
    private final TextToSpeech textToSpeech;
    private final ExclusiveResource microphone;
    private final AssistantTurnService turns;
    private final ResponseTemplates templates;
    private final Executor speechExecutor;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private volatile Language lastLanguage = Language.ENGLISH;

    public VoiceSession(AudioSource audio,
                        SpeechToText speechToText,
                        TextToSpeech textToSpeech,
                        ExclusiveResource microphone,
                        AssistantTurnService turns,
                        ResponseTemplates templates,
                        Executor speechExecutor) {
        this.audio = Objects.requireNonNull(audio, "audio must not be null");
        this.speechToText = Objects.requireNonNull(speechToText, "speechToText must not be null");
        this.textToSpeech = Objects.requireNonNull(textToSpeech, "textToSpeech must not be null");
        this.microphone = Objects.requireNonNull(microphone, "microphone must not be null");
        this.turns = Objects.requireNonNull(turns, "turns must not be null");
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
        this.speechExecutor = Objects.requireNonNull(speechExecutor, "speechExecutor must not be null");
    }

    /**
     * Runs one full turn from the microphone. The response is also queued for speech.
     *
     * @return the turn's response; its status tells whether anything was heard
     */
    public TurnResponse listenOnce() {
        Language language = lastLanguage;
        AudioClip clip;
        try (ExclusiveResource.Lease lease = microphone.acquire()) {
            clip = audio.record();
        } catch (ResourceBusyException e) {
            LOG.warn("Microphone busy; skipping turn");
            return speak(TurnResponse.failed(templates.deviceBusy(language), Intent.CONVERSATION, language,
                    TurnStatus.RESOURCE_BUSY));
        } catch (TurnCancelledException e) {
            LOG.info("Listening cancelled");
            return TurnResponse.failed(templates.cancelled(language), Intent.CONVERSATION, language,
                    TurnStatus.CANCELLED);
        } catch (CollaboratorException e) {
            LOG.warn("Recording failed: {}", e.getMessage());
            return speak(couldNotHear(language));
        }

        if (clip == null || clip.isEmpty()) {
            LOG.debug("Nothing recorded");
            return speak(TurnResponse.failed(templates.emptyUtterance(language), Intent.CONVERSATION, language,
                    TurnStatus.EMPTY_UTTERANCE));
        }

        Transcript transcript;
        try {
            transcript = speechToText.transcribe(clip);
        } catch (CollaboratorException e) {
            LOG.warn("Transcription failed: {}", e.getMessage());
            return speak(couldNotHear(language));
        }

        TurnResponse response = turns.handle(transcript.text(), transcript.languageHint());
        lastLanguage = response.language();
        if (response.sessionFinished()) {
            running.set(false);
        }
        return speak(response);
    }

    /**
     * Loops {@link #listenOnce()} until the user says goodbye, {@link #stop()} is called or the
     * thread is interrupted.
     */
    public void run() {
        LOG.info("Voice session started");
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                listenOnce();
            } catch (RuntimeException e) {
                LOG.error("Turn failed unexpectedly; listening again", e);
            }
        }
        LOG.info("Voice session stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public void stop() {
        running.set(false);
    }

    private TurnResponse couldNotHear(Language language) {
        return TurnResponse.failed(templates.couldNotHear(language), Intent.CONVERSATION, language,
                TurnStatus.COLLABORATOR_UNAVAILABLE);
    }

    private TurnResponse speak(TurnResponse response) {
        String text = response.responseText();
        Language language = response.language();
        try {
            speechExecutor.execute(() -> {
                try {
                    textToSpeech.speak(text, language);
                } catch (CollaboratorException e) {
                    LOG.warn("Speech synthesis failed: {}", e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Speech queue full; response not spoken");
        }
        return response;
    }
}
