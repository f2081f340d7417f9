package com.syntaxprime.elephant.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Nested
    @DisplayName("querySummary()")
    class QuerySummaryTest {
        @Test
        @DisplayName("Should return len=0 and id=none for null query")
        void shouldHandleNull() {
            assertThat(LogSanitizer.querySummary(null)).isEqualTo("[len=0,id=none]");
        }

        @Test
        @DisplayName("Should never include the query text")
        void shouldHideQueryText() {
            String result = LogSanitizer.querySummary("marketing email");
            assertThat(result).startsWith("[len=15,id=").doesNotContain("marketing");
        }
    }

    @Nested
    @DisplayName("sanitize()")
    class SanitizeTest {
        @Test
        @DisplayName("Should replace newlines and strip control characters")
        void shouldStripControlChars() {
            assertThat(LogSanitizer.sanitize("line1\r\nline2\u0007")).isEqualTo("line1 line2");
        }

        @Test
        @DisplayName("Should cap long values")
        void shouldCapLength() {
            assertThat(LogSanitizer.sanitize("t".repeat(200))).isEqualTo("t".repeat(80) + "...");
        }

        @Test
        @DisplayName("Should return empty string for null input")
        void shouldHandleNull() {
            assertThat(LogSanitizer.sanitize(null)).isEmpty();
        }
    }
}
