package com.phillippitts.vani.service.turn;

import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.domain.TurnResponse;
import com.phillippitts.vani.domain.TurnStatus;
import com.phillippitts.vani.exception.CollaboratorUnavailableException;
import com.phillippitts.vani.service.collaborator.AudioClip;
import com.phillippitts.vani.service.collaborator.AudioSource;
import com.phillippitts.vani.service.collaborator.CollaboratorNames;
import com.phillippitts.vani.service.collaborator.SpeechToText;
import com.phillippitts.vani.service.collaborator.TextToSpeech;
import com.phillippitts.vani.service.collaborator.Transcript;
import com.phillippitts.vani.service.dispatch.DispatchSettings;
import com.phillippitts.vani.service.dispatch.ResponseTemplates;
import com.phillippitts.vani.service.resource.ExclusiveResource;
import com.phillippitts.vani.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VoiceSessionTest {

    private static final AudioClip CLIP = new AudioClip(new byte[] {1, 2, 3, 4}, 16000);

    private AudioSource audio;
    private SpeechToText speechToText;
    private TextToSpeech textToSpeech;
    private ExclusiveResource microphone;
    private AssistantTurnService turns;
    private SyncExecutor speechExecutor;
    private VoiceSession session;

    @BeforeEach
    void setUp() {
        audio = mock(AudioSource.class);
        speechToText = mock(SpeechToText.class);
        textToSpeech = mock(TextToSpeech.class);
        microphone = new ExclusiveResource(CollaboratorNames.MICROPHONE, 20);
        turns = mock(AssistantTurnService.class);
        speechExecutor = new SyncExecutor();
        session = newSession(speechExecutor);
    }

    private VoiceSession newSession(Executor executor) {
        return new VoiceSession(audio, speechToText, textToSpeech, microphone, turns,
                new ResponseTemplates(DispatchSettings.defaults()), executor);
    }

    @Test
    void shouldTranscribeHandleAndSpeak() {
        when(audio.record()).thenReturn(CLIP);
        when(speechToText.transcribe(CLIP)).thenReturn(new Transcript("open firefox", Language.ENGLISH));
        when(turns.handle("open firefox", Language.ENGLISH))
                .thenReturn(TurnResponse.ok("Opening firefox", "opened firefox", Intent.OPEN_APP, Language.ENGLISH));

        TurnResponse response = session.listenOnce();

        assertThat(response.responseText()).isEqualTo("Opening firefox");
        verify(textToSpeech).speak("Opening firefox", Language.ENGLISH);
        assertThat(speechExecutor.executedCount()).isEqualTo(1);
        assertThat(microphone.isHeld()).isFalse();
    }

    @Test
    void shouldAnswerInPreviousLanguageWhenTranscriptionFails() {
        when(audio.record()).thenReturn(CLIP);
        when(speechToText.transcribe(CLIP)).thenReturn(new Transcript("नमस्ते", Language.HINDI));
        when(turns.handle("नमस्ते", Language.HINDI))
                .thenReturn(TurnResponse.ok("नमस्ते!", "", Intent.CONVERSATION, Language.HINDI));
        session.listenOnce();

        when(speechToText.transcribe(CLIP))
                .thenThrow(new CollaboratorUnavailableException("engine crashed", CollaboratorNames.SPEECH_TO_TEXT));
        TurnResponse response = session.listenOnce();

        assertThat(response.status()).isEqualTo(TurnStatus.COLLABORATOR_UNAVAILABLE);
        assertThat(response.language()).isEqualTo(Language.HINDI);
        assertThat(response.responseText()).isEqualTo("मैं वह सुन नहीं सकी। कृपया फिर से कोशिश करें।");
    }

    @Test
    void shouldSkipTurnWhenMicrophoneIsBusy() {
        try (ExclusiveResource.Lease held = microphone.acquire()) {
            TurnResponse response = session.listenOnce();

            assertThat(response.status()).isEqualTo(TurnStatus.RESOURCE_BUSY);
            verify(audio, never()).record();
        }
    }

    @Test
    void shouldRepromptWithoutTranscribingSilence() {
        when(audio.record()).thenReturn(new AudioClip(new byte[0], 16000));

        TurnResponse response = session.listenOnce();

        assertThat(response.status()).isEqualTo(TurnStatus.EMPTY_UTTERANCE);
        verify(speechToText, never()).transcribe(any());
        verify(textToSpeech).speak("I didn't catch that. Please say it again.", Language.ENGLISH);
        assertThat(speechExecutor.executedCount()).isEqualTo(1);
    }

    @Test
    void shouldReturnResponseEvenWhenSpeechQueueRejects() {
        Executor rejecting = task -> {
            throw new RejectedExecutionException("queue full");
        };
        session = newSession(rejecting);
        when(audio.record()).thenReturn(CLIP);
        when(speechToText.transcribe(CLIP)).thenReturn(new Transcript("take a screenshot", null));
        when(turns.handle("take a screenshot", null))
                .thenReturn(TurnResponse.ok("Screenshot saved", "", Intent.SCREENSHOT, Language.ENGLISH));

        assertThat(session.listenOnce().responseText()).isEqualTo("Screenshot saved");
    }

    @Test
    void shouldSurviveSpeechSynthesisFailure() {
        doThrow(new CollaboratorUnavailableException("no voice", CollaboratorNames.TEXT_TO_SPEECH))
                .when(textToSpeech).speak(anyString(), any());
        when(audio.record()).thenReturn(CLIP);
        when(speechToText.transcribe(CLIP)).thenReturn(new Transcript("hello", null));
        when(turns.handle("hello", null))
                .thenReturn(TurnResponse.ok("Hi", "", Intent.CONVERSATION, Language.ENGLISH));

        assertThat(session.listenOnce().status()).isEqualTo(TurnStatus.OK);
    }

    @Test
    void shouldStopLoopWhenSessionFinishes() {
        when(audio.record()).thenReturn(CLIP);
        when(speechToText.transcribe(CLIP)).thenReturn(new Transcript("goodbye", null));
        when(turns.handle("goodbye", null)).thenReturn(new TurnResponse("Goodbye! Vani signing off.",
                "session finished", Intent.EXIT, Language.ENGLISH, TurnStatus.OK, true));

        Thread loop = new Thread(session::run, "voice-session-test");
        loop.start();

        await().atMost(Duration.ofSeconds(2)).until(() -> !loop.isAlive());
        assertThat(session.isRunning()).isFalse();
        verify(textToSpeech).speak("Goodbye! Vani signing off.", Language.ENGLISH);
    }

    @Test
    void shouldStopLoopWhenAsked() {
        when(audio.record()).thenReturn(new AudioClip(new byte[0], 16000));

        Thread loop = new Thread(session::run, "voice-session-test");
        loop.start();
        session.stop();

        await().atMost(Duration.ofSeconds(2)).until(() -> !loop.isAlive());
    }
}
