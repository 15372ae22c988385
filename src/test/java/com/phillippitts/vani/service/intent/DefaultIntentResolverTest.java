package com.phillippitts.vani.service.intent;

import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.domain.NormalizedUtterance;
import com.phillippitts.vani.exception.UnresolvableIntentException;
import com.phillippitts.vani.service.language.LanguageNormalizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultIntentResolverTest {

    private final LanguageNormalizer normalizer = new LanguageNormalizer();
    private final DefaultIntentResolver resolver =
            new DefaultIntentResolver(DefaultTriggerRules.create(EntityCatalog.defaults()));

    private Intent resolve(String raw) {
        NormalizedUtterance n = normalizer.normalize(raw);
        return resolver.resolve(n.text(), n.language());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "What do you see?",
            "क्या दिख रहा है",
            "तुम क्या देख रहे हो",
            "તમે શું જુઓ છો",
            "घड़ी में क्या समय है?",
            "how many people are in the room"
    })
    void shouldResolveVisionPhrasesInAllLanguages(String raw) {
        assertThat(resolve(raw)).isEqualTo(Intent.VISION);
    }

    @ParameterizedTest
    @CsvSource({
            "close firefox, CLOSE_APP",
            "open firefox, OPEN_APP",
            "open google chrome, OPEN_APP",
            "open youtube in firefox, OPEN_WEBSITE",
            "go to example.org, OPEN_WEBSITE",
            "take a screenshot, SCREENSHOT",
            "show me the battery, SYSTEM_STATUS",
            "mute the volume, VOLUME_CONTROL",
            "search for cricket scores, WEB_SEARCH",
            "tell me about the taj mahal, KNOWLEDGE",
            "who are you, IDENTITY",
            "goodbye, EXIT",
            "clear history, RESET",
            "tell me a joke, CONVERSATION"
    })
    void shouldResolveEnglishCommands(String raw, Intent expected) {
        assertThat(resolve(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "फ़ायरफ़ॉक्स बंद करो, CLOSE_APP",
            "यूट्यूब खोलो, OPEN_WEBSITE",
            "तुम कौन हो, IDENTITY",
            "अलविदा, EXIT",
            "ફાયરફોક્સ બંધ કરો, CLOSE_APP",
            "યુટ્યુબ ખોલો, OPEN_WEBSITE",
            "આજના સમાચાર, WEB_SEARCH"
    })
    void shouldResolveVerbFinalCommands(String raw, Intent expected) {
        assertThat(resolve(raw)).isEqualTo(expected);
    }

    @Test
    void shouldPreferControlOverVision() {
        assertThat(resolve("reset the camera")).isEqualTo(Intent.RESET);
    }

    @Test
    void shouldPreferVisionOverWebsite() {
        assertThat(resolve("open youtube and describe what you see")).isEqualTo(Intent.VISION);
    }

    @Test
    void shouldPreferWebsiteOverApplication() {
        assertThat(resolve("open firefox and go to github")).isEqualTo(Intent.OPEN_WEBSITE);
    }

    @Test
    void shouldPreferApplicationOverSystem() {
        assertThat(resolve("open terminal and check the battery")).isEqualTo(Intent.OPEN_APP);
    }

    @Test
    void shouldPreferSystemOverInformation() {
        assertThat(resolve("take a screenshot of the news")).isEqualTo(Intent.SCREENSHOT);
    }

    @Test
    void shouldFallToWebSearchWithoutExplicitOpenTarget() {
        assertThat(resolve("open the latest news about cricket")).isEqualTo(Intent.WEB_SEARCH);
    }

    @ParameterizedTest
    @CsvSource({
            "open spotify, OPEN_APP",
            "launch the music player, OPEN_APP",
            "close notepad, CLOSE_APP",
            "quit my editor, CLOSE_APP",
            "स्पॉटिफ़ाई खोलो, OPEN_APP",
            "नोटपैड बंद करो, CLOSE_APP",
            "નોટપેડ બંધ કરો, CLOSE_APP"
    })
    void shouldResolveUnknownApplicationTargetsToApplicationIntents(String raw, Intent expected) {
        assertThat(resolve(raw)).isEqualTo(expected);
    }

    @Test
    void shouldRankSpecificRulesAboveOpenEndedVerbs() {
        assertThat(resolve("open youtube")).isEqualTo(Intent.OPEN_WEBSITE);
        assertThat(resolve("start over")).isEqualTo(Intent.RESET);
        assertThat(resolve("आवाज़ बंद करो")).isEqualTo(Intent.VOLUME_CONTROL);
        assertThat(resolve("open the news")).isEqualTo(Intent.WEB_SEARCH);
        assertThat(resolve("quit")).isEqualTo(Intent.EXIT);
        assertThat(resolve("बंद करो")).isEqualTo(Intent.EXIT);

        List<RuleMatch> ranked = resolver.rankedMatches("open firefox", Language.ENGLISH);
        assertThat(ranked.get(0).rule().catchAll()).isFalse();
        assertThat(ranked).anyMatch(m -> m.rule().catchAll());
    }

    @Test
    void shouldOpenWebsiteWhenExplicitOpenTargetPresent() {
        assertThat(resolve("open github and find the latest news")).isEqualTo(Intent.OPEN_WEBSITE);
    }

    @Test
    void shouldBreakTierTiesByLongestSpan() {
        // "weather today" (web search) is longer than "what is" (knowledge)
        assertThat(resolve("what is the weather today")).isEqualTo(Intent.WEB_SEARCH);
        assertThat(resolve("what is the latest news")).isEqualTo(Intent.WEB_SEARCH);
    }

    @Test
    void shouldRankMatchesBestFirst() {
        List<RuleMatch> ranked = resolver.rankedMatches("open firefox and go to github", Language.ENGLISH);

        assertThat(ranked).isNotEmpty();
        assertThat(ranked.get(0).intent()).isEqualTo(Intent.OPEN_WEBSITE);
        assertThat(ranked).extracting(RuleMatch::intent).contains(Intent.OPEN_APP);
    }

    @Test
    void shouldBeDeterministic() {
        String text = "open the latest news about cricket";

        List<RuleMatch> first = resolver.rankedMatches(text, Language.ENGLISH);
        List<RuleMatch> second = resolver.rankedMatches(text, Language.ENGLISH);

        assertThat(first).isEqualTo(second);
        assertThat(resolver.resolve(text, Language.ENGLISH)).isEqualTo(resolver.resolve(text, Language.ENGLISH));
    }

    @Test
    void shouldDefaultToConversationForEmptyText() {
        assertThat(resolver.resolve("", Language.ENGLISH)).isEqualTo(Intent.CONVERSATION);
        assertThat(resolver.rankedMatches("", Language.HINDI)).isEmpty();
    }

    @Test
    void shouldThrowFromStrictResolutionWhenNothingMatches() {
        assertThatThrownBy(() -> resolver.resolveStrict("tell me a joke", Language.ENGLISH))
                .isInstanceOf(UnresolvableIntentException.class);
        assertThat(resolver.resolveStrict("close firefox", Language.ENGLISH)).isEqualTo(Intent.CLOSE_APP);
    }
}
