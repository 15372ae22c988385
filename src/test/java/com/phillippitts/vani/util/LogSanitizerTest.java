package com.phillippitts.vani.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.preview(null)).isEmpty();
        assertThat(LogSanitizer.preview(null, 5)).isEmpty();
    }

    @Test
    void shouldKeepShortTextUnchanged() {
        assertThat(LogSanitizer.preview("close firefox")).isEqualTo("close firefox");
    }

    @Test
    void shouldCollapseLineBreaks() {
        assertThat(LogSanitizer.preview("CPU: 12%\nMemory:  40%")).isEqualTo("CPU: 12% Memory: 40%");
    }

    @Test
    void shouldTruncateAndReportLength() {
        assertThat(LogSanitizer.preview("what is the capital of france", 10))
                .isEqualTo("what is th… (29 chars)");
    }

    @Test
    void shouldReportOnlyLengthForZeroMax() {
        assertThat(LogSanitizer.preview("secret", 0)).isEqualTo("(6 chars)");
    }

    @Test
    void shouldUseDefaultPreviewLength() {
        String text = "a".repeat(LogSanitizer.PREVIEW_CHARS + 5);
        assertThat(LogSanitizer.preview(text)).startsWith("a".repeat(LogSanitizer.PREVIEW_CHARS) + "…");
    }
}
