package io.lexis;

import io.lexis.embeddings.EmbeddingConfig;
import io.lexis.embeddings.TfIdfEncoder;
import io.lexis.embeddings.Tokenizer;
import io.lexis.embeddings.Vocabulary;
import io.lexis.embeddings.VocabularyBuilder;
import io.lexis.parser.PatternTopicalClassifier;
import io.lexis.parser.RegexMetadataExtractor;
import io.lexis.store.CorpusIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SearchRanker - similarity, boosts, highlights and filtering.
 */
class SearchRankerTest {

    private IndexConfig config;
    private Tokenizer tokenizer;
    private CorpusIndex index;
    private SearchRanker ranker;

    @BeforeEach
    void setUp() {
        config = IndexConfig.defaultConfig()
            .withEmbedding(EmbeddingConfig.defaults().withDimensions(8).withStopWords(Set.of("the", "a", "and")));
        tokenizer = Tokenizer.from(config.embedding());

        List<SourceFile> sources = List.of(
            source("docs/one.md", "the quick fox runs"),
            source("docs/two.md", "the lazy fox sleeps"),
            source("security/three.md", "a cat and a dog"));

        List<List<String>> corpus = new ArrayList<>();
        sources.forEach(s -> corpus.add(s.tokens()));
        Vocabulary vocabulary = new VocabularyBuilder(config.embedding()).build(corpus);
        TfIdfEncoder encoder = new TfIdfEncoder(vocabulary, tokenizer);

        DocumentEncoder documentEncoder = new DocumentEncoder(config, new RegexMetadataExtractor(),
            PatternTopicalClassifier.builder().rule("security", "^security/").build());
        List<DocumentRecord> records = new ArrayList<>();
        sources.forEach(s -> documentEncoder.encode(s, encoder).ifPresent(records::add));

        index = CorpusIndex.empty(8);
        index.replaceAll(vocabulary, records);
        ranker = new SearchRanker(config, tokenizer);
    }

    @Test
    void testSimilarityAndExactMatch() {
        List<SearchResult> results = ranker.search(index, "fox", SearchOptions.defaults().withMinScore(0));

        assertEquals(3, results.size());
        assertEquals("docs/one.md", results.get(0).document().relativePath());
        assertEquals("docs/two.md", results.get(1).document().relativePath());
        assertEquals(1.3, results.get(0).score(), 1e-6);
        assertEquals(0.0, results.get(2).score());
    }

    @Test
    void testTopicalBoostDoesNotFilter() {
        List<SearchResult> results = ranker.search(index, "dog",
            SearchOptions.defaults().withTopicalTag("secur").withMinScore(0));

        assertEquals(3, results.size());
        SearchResult top = results.get(0);
        assertEquals("security/three.md", top.document().relativePath());
        assertEquals(config.topicalBoost() + config.exactMatchBoost(), top.score(), 1e-9);
    }

    @Test
    void testBlankQueryHasNoExactMatchBoost() {
        List<SearchResult> results = ranker.search(index, "   ", SearchOptions.defaults().withMinScore(0));

        assertTrue(results.stream().allMatch(r -> r.score() == 0.0));
        assertTrue(results.stream().allMatch(r -> r.highlights().isEmpty()));
    }

    @Test
    void testLimit() {
        List<SearchResult> results = ranker.search(index, "fox", SearchOptions.defaults().withLimit(1));

        assertEquals(1, results.size());
    }

    @Test
    void testMinScoreFilters() {
        assertTrue(ranker.search(index, "runs fox", SearchOptions.defaults().withMinScore(1.1)).isEmpty());
    }

    @Test
    void testHighlightsAreBoundedAndWrapped() {
        String content = "alpha " + "beta ".repeat(20) + "alpha gamma alpha delta alpha";

        List<String> highlights = ranker.highlights(content, "ALPHA");

        assertEquals(config.maxHighlights(), highlights.size());
        assertTrue(highlights.get(0).startsWith("...alpha"));
        assertTrue(highlights.stream().allMatch(h -> h.endsWith("...")));
        assertTrue(highlights.get(0).length() <= "alpha".length() + 2 * config.highlightContext() + 6);
    }

    @Test
    void testHighlightOffsetsIgnoreCaseFolding() {
        String content = "\u0130".repeat(config.highlightContext() + 10) + " Needle " + "x".repeat(80);
        int at = content.indexOf("Needle");

        List<String> highlights = ranker.highlights(content, "needle");

        assertEquals(1, highlights.size());
        String expected = content.substring(at - config.highlightContext(),
            at + "needle".length() + config.highlightContext());
        assertEquals("..." + expected + "...", highlights.get(0));
    }

    @Test
    void testReturnedEmbeddingCannotChangeScores() {
        SearchResult first = ranker.search(index, "fox", SearchOptions.defaults()).get(0);
        Arrays.fill(first.document().embedding(), 5f);

        SearchResult again = ranker.search(index, "fox", SearchOptions.defaults()).get(0);

        assertEquals(1.3, again.score(), 1e-6);
        assertEquals(first.document(), again.document());
    }

    @Test
    void testInvalidOptions() {
        assertThrows(IllegalArgumentException.class, () -> SearchOptions.defaults().withLimit(0));
        assertThrows(IllegalArgumentException.class, () -> SearchOptions.defaults().withMinScore(Double.NaN));
    }

    private SourceFile source(String relativePath, String content) {
        return new SourceFile(Path.of("/corpus").resolve(relativePath), relativePath, content,
            tokenizer.tokenize(content), 0L);
    }
}
