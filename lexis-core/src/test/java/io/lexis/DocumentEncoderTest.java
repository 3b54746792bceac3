package io.lexis;

import io.lexis.embeddings.TfIdfEncoder;
import io.lexis.embeddings.Tokenizer;
import io.lexis.embeddings.Vectors;
import io.lexis.embeddings.Vocabulary;
import io.lexis.embeddings.VocabularyBuilder;
import io.lexis.parser.MetadataExtractor;
import io.lexis.parser.TopicalClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DocumentEncoderTest {

    private final Tokenizer tokenizer = Tokenizer.defaults();
    private TfIdfEncoder encoder;

    @BeforeEach
    void setUp() {
        Vocabulary vocabulary = new VocabularyBuilder(16, 1).build(List.of(
            tokenizer.tokenize("session cache expires"),
            tokenizer.tokenize("session login handler")));
        encoder = new TfIdfEncoder(vocabulary, tokenizer);
    }

    @Test
    void testEncodesRecord() {
        String content = "/** Session cache. */\nexport class SessionCache {}\nsession cache expires\n";
        SourceFile source = source("/corpus/src/cache.ts", content);

        DocumentRecord record = new DocumentEncoder(IndexConfig.defaultConfig()).encode(source, encoder).orElseThrow();

        assertEquals(DocumentRecord.idFor(source.path()), record.id());
        assertEquals(DocumentRecord.ID_LENGTH, record.id().length());
        assertEquals("src/cache.ts", record.relativePath());
        assertEquals(TopicalClassifier.DEFAULT_TAG, record.topicalTag());
        assertEquals("Session cache.", record.summary());
        assertEquals(List.of("SessionCache"), record.declaredSymbols());
        assertEquals(4, record.lineCount());
        assertEquals(DocumentRecord.hashContent(content), record.contentHash());
        assertEquals(1.0, Vectors.norm(record.embedding()), 1e-5);
    }

    @Test
    void testTokenlessFileIsRejected() {
        SourceFile source = source("/corpus/src/empty.ts", "{}");

        assertTrue(new DocumentEncoder(IndexConfig.defaultConfig()).encode(source, encoder).isEmpty());
    }

    @Test
    void testPreviewIsBounded() {
        IndexConfig config = IndexConfig.defaultConfig().withPreviewLength(10);
        SourceFile source = source("/corpus/src/long.md", "session " + "x".repeat(50));

        DocumentRecord record = new DocumentEncoder(config).encode(source, encoder).orElseThrow();

        assertEquals(10, record.contentPreview().length());
    }

    @Test
    void testFailingHeuristicsDoNotFailEncoding() {
        MetadataExtractor broken = new MetadataExtractor() {
            @Override
            public String summary(Path path, String content) {
                throw new IllegalStateException("boom");
            }

            @Override
            public List<String> declaredSymbols(Path path, String content) {
                return List.of();
            }

            @Override
            public List<String> referencedModules(Path path, String content) {
                return List.of();
            }
        };
        TopicalClassifier nullClassifier = (relativePath, content) -> null;

        Optional<DocumentRecord> record = new DocumentEncoder(IndexConfig.defaultConfig(), broken, nullClassifier)
            .encode(source("/corpus/src/login.md", "session login"), encoder);

        assertTrue(record.isPresent());
        assertEquals("", record.get().summary());
        assertEquals(TopicalClassifier.DEFAULT_TAG, record.get().topicalTag());
    }

    @Test
    void testUnknownTermsGiveZeroEmbedding() {
        DocumentRecord record = new DocumentEncoder(IndexConfig.defaultConfig())
            .encode(source("/corpus/src/other.md", "completely unrelated words"), encoder)
            .orElseThrow();

        assertEquals(0.0, Vectors.norm(record.embedding()));
    }

    private SourceFile source(String path, String content) {
        Path file = Path.of(path);
        return new SourceFile(file, Path.of("/corpus").relativize(file).toString().replace('\\', '/'),
            content, tokenizer.tokenize(content), 1_000L);
    }
}
