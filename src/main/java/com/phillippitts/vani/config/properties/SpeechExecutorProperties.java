package com.phillippitts.vani.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pool sizing for the speech synthesis executor.
 *
 * <p>Speech is one voice at a time, so the defaults keep a single worker and a short queue.
 */
@ConfigurationProperties(prefix = "assistant.speech-executor")
@Validated
public class SpeechExecutorProperties {

    @Positive
    private int corePoolSize = 1;

    @Positive
    private int maxPoolSize = 1;

    @PositiveOrZero
    private int queueCapacity = 8;

    private String threadNamePrefix = "speech-";

    public int getCorePoolSize() {
        return corePoolSize;
    }

    public void setCorePoolSize(int corePoolSize) {
        this.corePoolSize = corePoolSize;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }
}
