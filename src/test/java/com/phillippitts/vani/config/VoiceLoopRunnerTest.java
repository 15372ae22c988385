package com.phillippitts.vani.config;

import com.phillippitts.vani.service.turn.VoiceSession;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class VoiceLoopRunnerTest {

    @Test
    void shouldStartSessionOnItsOwnThreadAndStopOnDestroy() {
        VoiceSession session = mock(VoiceSession.class);
        VoiceLoopRunner runner = new VoiceLoopRunner(session);

        assertThat(runner.isStarted()).isFalse();
        runner.run(new DefaultApplicationArguments());

        assertThat(runner.isStarted()).isTrue();
        verify(session, timeout(1000)).run();

        runner.destroy();
        verify(session).stop();
    }
}
