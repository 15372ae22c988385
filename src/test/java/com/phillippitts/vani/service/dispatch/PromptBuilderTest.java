package com.phillippitts.vani.service.dispatch;

import com.phillippitts.vani.domain.ConversationTurn;
import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.domain.SearchContext;
import com.phillippitts.vani.domain.SearchSource;
import com.phillippitts.vani.domain.VisionContext;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private final PromptBuilder prompts = new PromptBuilder(DispatchSettings.defaults());

    @Test
    void shouldRenderBarePromptWithoutContext() {
        String prompt = prompts.conversation("hello", Language.ENGLISH, List.of(), Optional.empty(), Optional.empty());

        assertThat(prompt).isEqualTo(prompts.systemInstruction(Language.ENGLISH) + "\n\nUser: hello\nAssistant: ");
    }

    @Test
    void shouldPlaceVisionBeforeSearchBeforeDialogue() {
        VisionContext vision = new VisionContext("a laptop", Instant.EPOCH, 0, 1);
        SearchContext search = new SearchContext("weather", "Sunny, 31C", SearchSource.WEB, Instant.EPOCH);
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("what is the weather", Language.ENGLISH),
                ConversationTurn.assistant("Sunny", Language.ENGLISH));

        String prompt = prompts.conversation("and tomorrow?", Language.ENGLISH, history,
                Optional.of(vision), Optional.of(search));

        int visionAt = prompt.indexOf("Visual information (from camera): a laptop");
        int searchAt = prompt.indexOf("Search Results:\nweather: Sunny, 31C");
        int dialogueAt = prompt.indexOf("User: what is the weather\nAssistant: Sunny\n");
        assertThat(visionAt).isPositive();
        assertThat(searchAt).isGreaterThan(visionAt);
        assertThat(dialogueAt).isGreaterThan(searchAt);
        assertThat(prompt).endsWith("User: and tomorrow?\nAssistant: ");
    }

    @Test
    void shouldUseLocalizedNameAndInstruction() {
        assertThat(prompts.systemInstruction(Language.HINDI)).startsWith("तुम वाणी हो").contains("केवल हिंदी");
        assertThat(prompts.systemInstruction(Language.GUJARATI)).startsWith("તમે વાણી છો");
    }

    @Test
    void shouldLabelVisionInFollowUpPromptByLanguage() {
        VisionContext vision = new VisionContext("एक लाल कप", Instant.EPOCH, 0, 0);

        String prompt = prompts.visionFollowUp("इसका रंग क्या है", Language.HINDI, List.of(), vision);

        assertThat(prompt).contains("दृश्य जानकारी (कैमरा): एक लाल कप").endsWith("User: इसका रंग क्या है\nAssistant: ");
    }

    @Test
    void shouldFilterHistoryToOneLanguage() {
        List<ConversationTurn> turns = List.of(
                ConversationTurn.user("hi", Language.ENGLISH),
                ConversationTurn.user("નમસ્તે", Language.GUJARATI),
                ConversationTurn.assistant("Hello", Language.ENGLISH));

        assertThat(PromptBuilder.sameLanguage(turns, Language.ENGLISH))
                .extracting(ConversationTurn::text)
                .containsExactly("hi", "Hello");
        assertThat(PromptBuilder.sameLanguage(turns, Language.HINDI)).isEmpty();
    }
}
