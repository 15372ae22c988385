package com.phillippitts.vani.service.language;

import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.domain.NormalizedUtterance;
import org.junit.jupiter.api.Test;

import java.text.Normalizer;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageNormalizerTest {

    private final LanguageNormalizer normalizer = new LanguageNormalizer();

    @Test
    void shouldDetectEnglishAndLowerCase() {
        NormalizedUtterance n = normalizer.normalize("  Open   YouTube in Firefox! ");

        assertThat(n.language()).isEqualTo(Language.ENGLISH);
        assertThat(n.text()).isEqualTo("open youtube in firefox");
    }

    @Test
    void shouldDetectHindiFromDevanagari() {
        NormalizedUtterance n = normalizer.normalize("तुम क्या देख रहे हो?");

        assertThat(n.language()).isEqualTo(Language.HINDI);
        assertThat(n.text()).isEqualTo("तुम क्या देख रहे हो");
    }

    @Test
    void shouldDetectGujaratiFromGujaratiScript() {
        NormalizedUtterance n = normalizer.normalize("તમે શું જુઓ છો");

        assertThat(n.language()).isEqualTo(Language.GUJARATI);
    }

    @Test
    void shouldStripDanda() {
        NormalizedUtterance n = normalizer.normalize("अलविदा।");

        assertThat(n.text()).isEqualTo("अलविदा");
    }

    @Test
    void shouldPickMajorityScriptForMixedInput() {
        // "youtube" is 7 Latin letters against 9 Devanagari code points
        NormalizedUtterance n = normalizer.normalize("youtube खोलो ना भाई");

        assertThat(n.language()).isEqualTo(Language.HINDI);
    }

    @Test
    void shouldResolveScriptTieToEnglish() {
        assertThat(normalizer.detect("ab कख", Language.GUJARATI)).isEqualTo(Language.ENGLISH);
    }

    @Test
    void shouldReturnEmptyForBlankInput() {
        assertThat(normalizer.normalize("   ").isEmpty()).isTrue();
        assertThat(normalizer.normalize(null).isEmpty()).isTrue();
        assertThat(normalizer.normalize("?!.").isEmpty()).isTrue();
    }

    @Test
    void shouldUseHintWhenNoScriptEvidence() {
        NormalizedUtterance n = normalizer.normalize("42", Language.GUJARATI);

        assertThat(n.language()).isEqualTo(Language.GUJARATI);
        assertThat(n.text()).isEqualTo("42");
    }

    @Test
    void shouldIgnoreHintWhenScriptIsClear() {
        NormalizedUtterance n = normalizer.normalize("close firefox", Language.HINDI);

        assertThat(n.language()).isEqualTo(Language.ENGLISH);
    }

    @Test
    void shouldProduceNfcText() {
        String decomposed = Normalizer.normalize("Café", Normalizer.Form.NFD);

        NormalizedUtterance n = normalizer.normalize(decomposed);

        assertThat(n.text()).isEqualTo("café");
        assertThat(Normalizer.isNormalized(n.text(), Normalizer.Form.NFC)).isTrue();
    }

    @Test
    void shouldBeDeterministic() {
        NormalizedUtterance a = normalizer.normalize("घड़ी में क्या समय है");
        NormalizedUtterance b = normalizer.normalize("घड़ी में क्या समय है");

        assertThat(a).isEqualTo(b);
    }
}
