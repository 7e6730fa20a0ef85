package com.jreinhal.insight.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void textHashIgnoresCaseAndSurroundingWhitespace() {
        assertThat(LogSanitizer.textHash("  Great Kettle ")).isEqualTo(LogSanitizer.textHash("great kettle"));
        assertThat(LogSanitizer.textHash("great kettle")).hasSize(64).isNotEqualTo(LogSanitizer.textHash("great toaster"));
    }

    @Test
    void sanitizeStripsLineBreaksAndControlCharacters() {
        assertThat(LogSanitizer.sanitize("admin\r\nFAKE ENTRY\u0007")).isEqualTo("admin FAKE ENTRY");
        assertThat(LogSanitizer.sanitize(null)).isEmpty();
    }

    @Test
    void querySummaryNeverContainsTheQuery() {
        assertThat(LogSanitizer.querySummary("secret plans")).startsWith("[len=12,id=").doesNotContain("secret");
    }
}
