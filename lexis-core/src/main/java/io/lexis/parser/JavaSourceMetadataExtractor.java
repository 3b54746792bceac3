package io.lexis.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.github.javaparser.javadoc.Javadoc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts metadata from Java sources with JavaParser.
 * 
 * <p>Declared symbols are type and method names in source order, referenced
 * modules are the import declarations, and the summary is the Javadoc of the
 * first top-level type. Non-Java files and sources that fail to parse are
 * handed to the regex extractor.</p>
 */
public class JavaSourceMetadataExtractor implements MetadataExtractor {
    
    private static final Logger log = LoggerFactory.getLogger(JavaSourceMetadataExtractor.class);
    
    private final RegexMetadataExtractor fallback;
    
    public JavaSourceMetadataExtractor() {
        this(new RegexMetadataExtractor());
    }
    
    public JavaSourceMetadataExtractor(RegexMetadataExtractor fallback) {
        this.fallback = fallback;
    }
    
    @Override
    public DocumentMetadata extract(Path path, String content) {
        Optional<CompilationUnit> unit = parse(path, content);
        if (unit.isEmpty()) {
            return fallback.extract(path, content);
        }
        CompilationUnit cu = unit.get();
        return new DocumentMetadata(
            summaryOf(cu).orElseGet(() -> fallback.summary(path, content)),
            symbolsOf(cu),
            importsOf(cu)
        );
    }
    
    @Override
    public String summary(Path path, String content) {
        return parse(path, content)
            .flatMap(this::summaryOf)
            .orElseGet(() -> fallback.summary(path, content));
    }
    
    @Override
    public List<String> declaredSymbols(Path path, String content) {
        return parse(path, content)
            .map(JavaSourceMetadataExtractor::symbolsOf)
            .orElseGet(() -> fallback.declaredSymbols(path, content));
    }
    
    @Override
    public List<String> referencedModules(Path path, String content) {
        return parse(path, content)
            .map(JavaSourceMetadataExtractor::importsOf)
            .orElseGet(() -> fallback.referencedModules(path, content));
    }
    
    private Optional<CompilationUnit> parse(Path path, String content) {
        if (!".java".equals(RegexMetadataExtractor.extensionOf(path))) {
            return Optional.empty();
        }
        
        // JavaParser instances are not thread-safe
        JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        ParseResult<CompilationUnit> result = parser.parse(content);
        
        if (!result.isSuccessful()) {
            log.debug("Falling back to regex extraction for {}: {}", path, result.getProblems());
            return Optional.empty();
        }
        return result.getResult();
    }
    
    private Optional<String> summaryOf(CompilationUnit cu) {
        return cu.getTypes().stream()
            .findFirst()
            .flatMap(type -> type.getJavadoc())
            .map(Javadoc::getDescription)
            .map(description -> description.toText().replaceAll("\\s+", " ").trim())
            .filter(text -> !text.isEmpty())
            .map(fallback::truncate);
    }
    
    private static List<String> symbolsOf(CompilationUnit cu) {
        List<String> symbols = new ArrayList<>();
        cu.accept(new SymbolCollector(), symbols);
        return symbols;
    }
    
    private static List<String> importsOf(CompilationUnit cu) {
        List<String> imports = new ArrayList<>();
        for (ImportDeclaration declaration : cu.getImports()) {
            imports.add(declaration.isAsterisk()
                ? declaration.getNameAsString() + ".*"
                : declaration.getNameAsString());
        }
        return imports;
    }
    
    /**
     * AST visitor collecting declared type and method names.
     */
    private static class SymbolCollector extends VoidVisitorAdapter<List<String>> {
        
        @Override
        public void visit(ClassOrInterfaceDeclaration node, List<String> symbols) {
            symbols.add(node.getNameAsString());
            super.visit(node, symbols);
        }
        
        @Override
        public void visit(EnumDeclaration node, List<String> symbols) {
            symbols.add(node.getNameAsString());
            super.visit(node, symbols);
        }
        
        @Override
        public void visit(RecordDeclaration node, List<String> symbols) {
            symbols.add(node.getNameAsString());
            super.visit(node, symbols);
        }
        
        @Override
        public void visit(AnnotationDeclaration node, List<String> symbols) {
            symbols.add(node.getNameAsString());
            super.visit(node, symbols);
        }
        
        @Override
        public void visit(MethodDeclaration node, List<String> symbols) {
            symbols.add(node.getNameAsString());
            super.visit(node, symbols);
        }
    }
}
