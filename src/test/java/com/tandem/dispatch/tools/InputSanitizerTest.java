package com.tandem.dispatch.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InputSanitizerTest {

    private final InputSanitizer sanitizer = new InputSanitizer();

    @Test
    @DisplayName("null stays null")
    void nullPassesThrough() {
        assertNull(sanitizer.sanitize(null));
    }

    @Test
    @DisplayName("plain text is only trimmed")
    void plainText() {
        assertEquals("Implemented the parser", sanitizer.sanitize("  Implemented the parser \n"));
    }

    @Test
    @DisplayName("script blocks are removed entirely")
    void scriptBlocksRemoved() {
        assertEquals("Hello", sanitizer.sanitize("<script type=\"text/javascript\">alert('x')</script>Hello"));
        assertEquals("ab", sanitizer.sanitize("a<SCRIPT>\nsteal()\n</SCRIPT>b"));
    }

    @Test
    @DisplayName("other markup is escaped")
    void markupEscaped() {
        assertEquals("&lt;b&gt;bold&lt;/b&gt; &amp; more", sanitizer.sanitize("<b>bold</b> & more"));
    }

    @Test
    @DisplayName("javascript URLs and inline handlers are stripped")
    void urlsAndHandlersStripped() {
        String cleaned = sanitizer.sanitize("<a href=\"javascript:alert(1)\" onclick=\"go()\">x</a>");

        assertFalse(cleaned.toLowerCase().contains("javascript:"));
        assertFalse(cleaned.contains("onclick="));
        assertFalse(cleaned.contains("<"));
    }

    @Test
    @DisplayName("words that merely start with on are kept")
    void ordinaryWordsKept() {
        assertEquals("content is online", sanitizer.sanitize("content is online"));
    }

    @Test
    @DisplayName("an equals sign after an on-word in prose is not a handler")
    void proseAssignmentsKept() {
        assertEquals("retry once = enough; set only=true", sanitizer.sanitize("retry once = enough; set only=true"));
    }

    @Test
    @DisplayName("single-quoted handlers are stripped with their value")
    void singleQuotedHandlerStripped() {
        assertEquals("&lt;img src=x &gt;", sanitizer.sanitize("<img src=x onerror='steal()'>"));
    }
}
