package com.phillippitts.vani.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Wait limit for the exclusive devices.
 *
 * <p>Properties:
 * <ul>
 *   <li>assistant.resource.acquire-timeout-ms - how long a turn waits for the microphone or
 *       camera before answering "busy" (default: 2000)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "assistant.resource")
@Validated
public class ResourceProperties {

    @Positive(message = "Acquire timeout must be positive")
    private int acquireTimeoutMs = 2000;

    public int getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public void setAcquireTimeoutMs(int acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }
}
