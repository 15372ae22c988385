package com.phillippitts.vani.service.intent;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TriggerPatternTest {

    private final EntityCatalog catalog = EntityCatalog.defaults();

    @Test
    void shouldMatchLiteralPhraseOnWordBoundaries() {
        TriggerPattern p = TriggerPattern.compile("news", catalog);

        assertThat(p.find("latest news today")).isPresent();
        assertThat(p.find("newsletter signup")).isEmpty();
    }

    @Test
    void shouldMatchWildcardAcrossWords() {
        TriggerPattern p = TriggerPattern.compile("what * see", catalog);

        assertThat(p.find("what can you see")).isPresent();
        assertThat(p.find("what see")).isEmpty();
    }

    @Test
    void shouldHonourAnchors() {
        TriggerPattern p = TriggerPattern.compile("^stop$", catalog);

        assertThat(p.find("stop")).isPresent();
        assertThat(p.find("stop the music")).isEmpty();
    }

    @Test
    void shouldCaptureEntitySlotWithOptionalWord() {
        TriggerPattern p = TriggerPattern.compile("open [the] <app>", catalog);

        Optional<TriggerPattern.Occurrence> withArticle = p.find("please open the google chrome now");
        Optional<TriggerPattern.Occurrence> without = p.find("open terminal");

        assertThat(withArticle).isPresent();
        assertThat(withArticle.get().slots()).containsEntry("app", "google chrome");
        assertThat(without.get().slots()).containsEntry("app", "terminal");
    }

    @Test
    void shouldCaptureOneOrTwoWordTarget() {
        TriggerPattern p = TriggerPattern.compile("^open [the] <target>$", catalog);

        assertThat(p.find("open spotify").get().slots()).containsEntry("target", "spotify");
        assertThat(p.find("open the music player").get().slots()).containsEntry("target", "music player");
        assertThat(p.find("open the latest news about cricket")).isEmpty();
        assertThat(p.find("open")).isEmpty();
    }

    @Test
    void shouldCaptureBareDomainAsSite() {
        TriggerPattern p = TriggerPattern.compile("go to <site>", catalog);

        assertThat(p.find("go to example.org").get().slots()).containsEntry("site", "example.org");
    }

    @Test
    void shouldCaptureEntityBeforeVerbInHindi() {
        TriggerPattern p = TriggerPattern.compile("<app> बंद करो", catalog);

        assertThat(p.find("फ़ायरफ़ॉक्स बंद करो")).isPresent();
    }

    @Test
    void shouldReportSpanOfOccurrence() {
        TriggerPattern p = TriggerPattern.compile("search for", catalog);

        TriggerPattern.Occurrence o = p.find("please search for cats").orElseThrow();

        assertThat(o.start()).isEqualTo(7);
        assertThat(o.end()).isEqualTo(17);
        assertThat(o.length()).isEqualTo(10);
    }

    @Test
    void shouldRemoveEveryOccurrence() {
        TriggerPattern p = TriggerPattern.compile("search for", catalog);

        assertThat(p.removeFrom("search for cats and search for dogs"))
                .doesNotContain("search")
                .contains("cats")
                .contains("dogs");
    }

    @Test
    void shouldExposeSlotNamesInOrder() {
        TriggerPattern p = TriggerPattern.compile("open [the] <site> in <browser>", catalog);

        assertThat(p.slotNames()).containsExactly("site", "browser");
        assertThat(p.source()).isEqualTo("open [the] <site> in <browser>");
    }

    @Test
    void shouldRejectMalformedPatterns() {
        assertThatThrownBy(() -> TriggerPattern.compile("  ", catalog))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TriggerPattern.compile("open <planet>", catalog))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("planet");
        assertThatThrownBy(() -> TriggerPattern.compile("open [the]", catalog))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TriggerPattern.compile("<app> and <app>", catalog))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }
}
