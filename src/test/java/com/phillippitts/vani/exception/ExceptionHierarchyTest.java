package com.phillippitts.vani.exception;

import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.Language;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void vaniExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        VaniException ex = new VaniException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void collaboratorExceptionShouldNameCollaborator() {
        CollaboratorUnavailableException ex = new CollaboratorUnavailableException("connection refused", "web-search");

        assertThat(ex.getMessage()).contains("connection refused").contains("web-search");
        assertThat(ex.getCollaborator()).isEqualTo("web-search");
        assertThat(ex).isInstanceOf(CollaboratorException.class);
    }

    @Test
    void timeoutShouldCarryDuration() {
        CollaboratorTimeoutException ex = new CollaboratorTimeoutException("knowledge", 5000);

        assertThat(ex.getTimeoutMs()).isEqualTo(5000);
        assertThat(ex.getMessage()).contains("5000ms").contains("knowledge");
        assertThat(ex).isInstanceOf(CollaboratorException.class);
    }

    @Test
    void desktopFailureReasonShouldBeMessage() {
        DesktopActionFailedException ex = new DesktopActionFailedException("firefox is not running");

        assertThat(ex.getReason()).isEqualTo("firefox is not running");
        assertThat(ex.getMessage()).isEqualTo("firefox is not running");
    }

    @Test
    void missingParameterShouldCopySlots() {
        List<String> slots = new ArrayList<>(List.of("direction"));
        MissingParameterException ex = new MissingParameterException(Intent.VOLUME_CONTROL, slots);
        slots.add("app");

        assertThat(ex.getSlots()).containsExactly("direction");
        assertThat(ex.getIntent()).isEqualTo(Intent.VOLUME_CONTROL);
    }

    @Test
    void unresolvableIntentShouldNotLeakText() {
        UnresolvableIntentException ex = new UnresolvableIntentException("my secret plans", Language.ENGLISH);

        assertThat(ex.getMessage()).doesNotContain("secret").contains("chars=15");
    }

    @Test
    void staleContextShouldNameKind() {
        StaleContextException ex = new StaleContextException(StaleContextException.ContextKind.VISION);

        assertThat(ex.getMessage()).contains("vision");
        assertThat(ex.getKind()).isEqualTo(StaleContextException.ContextKind.VISION);
    }

    @Test
    void allExceptionsShouldBeUnchecked() {
        assertThat(new EmptyUtteranceException()).isInstanceOf(RuntimeException.class);
        assertThat(new ResourceBusyException("camera", 10)).isInstanceOf(VaniException.class);
        assertThat(new TurnCancelledException("stop")).isInstanceOf(VaniException.class);
    }
}
