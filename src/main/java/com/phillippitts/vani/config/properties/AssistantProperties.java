package com.phillippitts.vani.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the assistant persona and search behaviour.
 *
 * <p>Properties:
 * <ul>
 *   <li>assistant.name / name-hi / name-gu - assistant name per script (default: Vani, वाणी, વાણી)</li>
 *   <li>assistant.default-browser - browser for websites opened without one (default: firefox)</li>
 *   <li>assistant.web-search-enabled - route search and knowledge turns to collaborators (default: true)</li>
 *   <li>assistant.web-search-max-results - hits requested per web search, 1..10 (default: 3)</li>
 *   <li>assistant.voice-loop-enabled - start the microphone loop at startup (default: false)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "assistant")
public class AssistantProperties {

    @NotBlank
    private final String name;

    private final String nameHi;

    private final String nameGu;

    private final String defaultBrowser;

    private final boolean webSearchEnabled;

    @Min(1)
    @Max(10)
    private final int webSearchMaxResults;

    private final boolean voiceLoopEnabled;

    @ConstructorBinding
    public AssistantProperties(String name,
                               String nameHi,
                               String nameGu,
                               String defaultBrowser,
                               Boolean webSearchEnabled,
                               Integer webSearchMaxResults,
                               Boolean voiceLoopEnabled) {
        this.name = name == null ? "Vani" : name;
        this.nameHi = nameHi == null ? "वाणी" : nameHi;
        this.nameGu = nameGu == null ? "વાણી" : nameGu;
        this.defaultBrowser = defaultBrowser == null ? "firefox" : defaultBrowser;
        this.webSearchEnabled = webSearchEnabled == null || webSearchEnabled;
        this.webSearchMaxResults = webSearchMaxResults == null ? 3 : webSearchMaxResults;
        this.voiceLoopEnabled = voiceLoopEnabled != null && voiceLoopEnabled;
    }

    public String getName() {
        return name;
    }

    public String getNameHi() {
        return nameHi;
    }

    public String getNameGu() {
        return nameGu;
    }

    public String getDefaultBrowser() {
        return defaultBrowser;
    }

    public boolean isWebSearchEnabled() {
        return webSearchEnabled;
    }

    public int getWebSearchMaxResults() {
        return webSearchMaxResults;
    }

    public boolean isVoiceLoopEnabled() {
        return voiceLoopEnabled;
    }
}
