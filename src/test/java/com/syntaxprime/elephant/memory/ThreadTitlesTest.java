package com.syntaxprime.elephant.memory;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ThreadTitlesTest {

    @Test
    @DisplayName("Generated placeholders are generic")
    void placeholderIsGeneric() {
        String placeholder = ThreadTitles.placeholder(Instant.parse("2025-01-01T10:00:00Z"));

        assertThat(placeholder).startsWith("Conversation ");
        assertThat(ThreadTitles.isGeneric(placeholder)).isTrue();
    }

    @Test
    @DisplayName("Only placeholder and New Conversation titles are generic")
    void recognizesGenericTitles() {
        assertThat(ThreadTitles.isGeneric("New Conversation")).isTrue();
        assertThat(ThreadTitles.isGeneric("Conversation 2025-01-01 10:00")).isTrue();
        assertThat(ThreadTitles.isGeneric("Conversation 2025-01-01 10:00 notes")).isFalse();
        assertThat(ThreadTitles.isGeneric("Q3 Launch Planning")).isFalse();
        assertThat(ThreadTitles.isGeneric(null)).isFalse();
    }

    @Test
    @DisplayName("Titles from content are stripped and capped at 50 characters")
    void derivesTitleFromContent() {
        assertThat(ThreadTitles.fromContent("  Let's plan the Q3 launch  ")).isEqualTo("Let's plan the Q3 launch");
        assertThat(ThreadTitles.fromContent("y".repeat(50))).isEqualTo("y".repeat(50));
        assertThat(ThreadTitles.fromContent("y".repeat(51))).isEqualTo("y".repeat(50) + "...");
    }

    @Test
    @DisplayName("Blank content gives no title")
    void blankContentHasNoTitle() {
        assertThat(ThreadTitles.fromContent("   ")).isNull();
        assertThat(ThreadTitles.fromContent(null)).isNull();
    }
}
