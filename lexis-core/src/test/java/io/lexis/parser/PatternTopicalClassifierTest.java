package io.lexis.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PatternTopicalClassifierTest {

    private final TopicalClassifier classifier = PatternTopicalClassifier.builder()
        .rule("security", "vault|auth")
        .rule("storage", "index|persist")
        .build();

    @Test
    void testMatchesPath() {
        assertEquals("security", classifier.classify("src/auth/Login.java", "class Login {}"));
    }

    @Test
    void testMatchesLeadingContentIgnoringCase() {
        assertEquals("storage", classifier.classify("src/Foo.java", "// PERSISTS records to disk"));
    }

    @Test
    void testFirstRuleWins() {
        assertEquals("security", classifier.classify("src/index/auth.ts", ""));
    }

    @Test
    void testOnlyLeadingContentIsSampled() {
        String content = "x".repeat(600) + " vault";

        assertEquals(TopicalClassifier.DEFAULT_TAG, classifier.classify("src/Foo.java", content));
    }

    @Test
    void testCustomFallbackTag() {
        TopicalClassifier custom = PatternTopicalClassifier.builder()
            .rule("docs", "\\.md$")
            .fallbackTag("misc")
            .build();

        assertEquals("misc", custom.classify("src/Foo.java", "class Foo {}"));
    }

    @Test
    void testConstantClassifier() {
        assertEquals("core", TopicalClassifier.constant("core").classify("anything", "at all"));
    }
}
