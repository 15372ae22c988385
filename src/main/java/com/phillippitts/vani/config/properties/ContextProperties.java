package com.phillippitts.vani.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Sizes of the conversation memory. Read once at startup.
 */
@Validated
@ConfigurationProperties(prefix = "assistant.context")
public class ContextProperties {

    /** Turns kept in history; a user utterance and its reply count as two. */
    @Min(2)
    @Max(200)
    private final int historyCapacity;

    /** History turns replayed to the conversation model. */
    @Min(0)
    @Max(50)
    private final int promptHistorySize;

    /** User turns after which an untouched vision description is treated as stale. */
    @Min(1)
    @Max(50)
    private final int visionStalenessTurns;

    @ConstructorBinding
    public ContextProperties(Integer historyCapacity, Integer promptHistorySize, Integer visionStalenessTurns) {
        this.historyCapacity = historyCapacity == null ? 20 : historyCapacity;
        this.promptHistorySize = promptHistorySize == null ? 6 : promptHistorySize;
        this.visionStalenessTurns = visionStalenessTurns == null ? 5 : visionStalenessTurns;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public int getPromptHistorySize() {
        return promptHistorySize;
    }

    public int getVisionStalenessTurns() {
        return visionStalenessTurns;
    }
}
