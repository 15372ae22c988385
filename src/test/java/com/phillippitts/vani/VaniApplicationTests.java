package com.phillippitts.vani;

import com.phillippitts.vani.config.VoiceLoopRunner;
import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.TurnResponse;
import com.phillippitts.vani.domain.TurnStatus;
import com.phillippitts.vani.service.turn.AssistantTurnService;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "assistant.resource.acquire-timeout-ms=100")
class VaniApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private AssistantTurnService turns;

    @Autowired
    private MeterRegistry registry;

    @Test
    void contextLoads() {
        assertThat(context.getBeanNamesForType(VoiceLoopRunner.class)).isEmpty();
    }

    @Test
    void answersIdentityWithoutAnyCollaborator() {
        TurnResponse response = turns.handle("who are you", null);

        assertThat(response.intent()).isEqualTo(Intent.IDENTITY);
        assertThat(response.responseText()).startsWith("I am Vani");
    }

    @Test
    void reportsUnconfiguredDesktopAsUnavailable() {
        TurnResponse response = turns.handle("close firefox", null);

        assertThat(response.status()).isEqualTo(TurnStatus.COLLABORATOR_UNAVAILABLE);
        assertThat(response.responseText()).isEqualTo("I'm sorry, I couldn't process that");
        assertThat(registry.find("vani.collaborator.failure").tag("collaborator", "desktop").counter())
                .isNotNull();
    }
}
