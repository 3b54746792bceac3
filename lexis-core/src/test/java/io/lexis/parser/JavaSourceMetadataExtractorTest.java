package io.lexis.parser;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JavaSourceMetadataExtractor - AST extraction and regex fallback.
 */
class JavaSourceMetadataExtractorTest {

    private final JavaSourceMetadataExtractor extractor = new JavaSourceMetadataExtractor();

    private static final String SESSION_STORE = """
        package demo;

        import java.util.List;
        import java.util.concurrent.*;

        /**
         * Keeps track of open sessions.
         */
        public class SessionStore {
            public void open() {}

            enum State { OPEN }

            private record Entry(String id) {}
        }
        """;

    @Test
    void testExtractsTypesAndMethodsInOrder() {
        DocumentMetadata metadata = extractor.extract(Path.of("SessionStore.java"), SESSION_STORE);

        assertEquals(List.of("SessionStore", "open", "State", "Entry"), metadata.declaredSymbols());
    }

    @Test
    void testExtractsImports() {
        assertEquals(List.of("java.util.List", "java.util.concurrent.*"),
            extractor.referencedModules(Path.of("SessionStore.java"), SESSION_STORE));
    }

    @Test
    void testSummaryFromTypeJavadoc() {
        assertEquals("Keeps track of open sessions.",
            extractor.summary(Path.of("SessionStore.java"), SESSION_STORE));
    }

    @Test
    void testSummaryFallsBackWithoutJavadoc() {
        String content = "package demo;\n\npublic class Plain {\n}\n";

        assertEquals("package demo;  public class Plain { }",
            extractor.summary(Path.of("Plain.java"), content));
    }

    @Test
    void testUnparsableSourceFallsBackToRegex() {
        String content = "class Broken {\n    void x( {\n";

        DocumentMetadata metadata = extractor.extract(Path.of("Broken.java"), content);

        assertEquals(List.of("Broken"), metadata.declaredSymbols());
    }

    @Test
    void testNonJavaFileUsesRegex() {
        String content = "export const answer = 42;\nimport x from 'lodash';\n";

        DocumentMetadata metadata = extractor.extract(Path.of("answer.ts"), content);

        assertEquals(List.of("answer"), metadata.declaredSymbols());
        assertEquals(List.of("lodash"), metadata.referencedModules());
    }
}
