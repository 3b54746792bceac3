package io.lexis.parser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based metadata extraction, selected by file extension.
 * 
 * <p>Handles JavaScript/TypeScript exports and imports, JVM declarations and
 * imports, and Markdown headings. Files of other types get the
 * JavaScript/TypeScript patterns.</p>
 */
public class RegexMetadataExtractor implements MetadataExtractor {
    
    private static final Set<String> JVM_EXTENSIONS = Set.of(".java", ".kt", ".kts", ".groovy", ".scala");
    private static final Set<String> MARKDOWN_EXTENSIONS = Set.of(".md", ".markdown");
    
    private static final Pattern DOC_COMMENT = Pattern.compile("/\\*\\*[\\s\\S]*?\\*/");
    
    private static final Pattern SCRIPT_EXPORT = Pattern.compile(
        "export\\s+(?:default\\s+)?(?:abstract\\s+)?(?:async\\s+)?(?:class|function|const|interface|type|enum)\\s+([A-Za-z_$][\\w$]*)");
    private static final Pattern SCRIPT_IMPORT = Pattern.compile(
        "import\\s+(?:[^;'\"]*?\\s+from\\s+)?['\"]([^'\"]+)['\"]");
    private static final Pattern SCRIPT_REQUIRE = Pattern.compile(
        "require\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");
    
    private static final Pattern JVM_DECLARATION = Pattern.compile(
        "\\b(?:class|interface|enum|record|object)\\s+([A-Za-z_$][\\w$]*)");
    private static final Pattern JVM_IMPORT = Pattern.compile(
        "(?m)^\\s*import\\s+(?:static\\s+)?([\\w.]+(?:\\.\\*)?)\\s*;?\\s*$");
    
    private static final Pattern MARKDOWN_HEADING = Pattern.compile(
        "(?m)^#{1,6}\\s+(.+?)\\s*#*\\s*$");
    
    private final int summaryLength;
    private final int summaryLines;
    
    public RegexMetadataExtractor() {
        this(200, 5);
    }
    
    public RegexMetadataExtractor(int summaryLength, int summaryLines) {
        this.summaryLength = summaryLength;
        this.summaryLines = summaryLines;
    }
    
    /**
     * Uses the first {@code /** ... *}{@code /} comment with its markers stripped,
     * or the first lines of the file joined by spaces.
     */
    @Override
    public String summary(Path path, String content) {
        Matcher matcher = DOC_COMMENT.matcher(content);
        if (matcher.find()) {
            String cleaned = cleanDocComment(matcher.group());
            if (!cleaned.isEmpty()) {
                return truncate(cleaned);
            }
        }
        
        String[] lines = content.split("\n", summaryLines + 1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(summaryLines, lines.length); i++) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(lines[i].strip());
        }
        return truncate(sb.toString().strip());
    }
    
    @Override
    public List<String> declaredSymbols(Path path, String content) {
        String extension = extensionOf(path);
        if (JVM_EXTENSIONS.contains(extension)) {
            return matches(JVM_DECLARATION, content);
        }
        if (MARKDOWN_EXTENSIONS.contains(extension)) {
            return matches(MARKDOWN_HEADING, content);
        }
        return matches(SCRIPT_EXPORT, content);
    }
    
    @Override
    public List<String> referencedModules(Path path, String content) {
        String extension = extensionOf(path);
        if (JVM_EXTENSIONS.contains(extension)) {
            return matches(JVM_IMPORT, content);
        }
        if (MARKDOWN_EXTENSIONS.contains(extension)) {
            return List.of();
        }
        List<String> modules = matches(SCRIPT_IMPORT, content);
        modules.addAll(matches(SCRIPT_REQUIRE, content));
        return modules;
    }
    
    /**
     * Strips comment markers and leading asterisks, collapsing whitespace.
     */
    static String cleanDocComment(String comment) {
        return comment
            .replaceAll("/\\*\\*|\\*/", "")
            .replaceAll("\\s*\\*\\s*", " ")
            .replaceAll("\\s+", " ")
            .trim();
    }
    
    String truncate(String text) {
        if (text.length() <= summaryLength) {
            return text;
        }
        return text.substring(0, summaryLength);
    }
    
    static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
    
    private static List<String> matches(Pattern pattern, String content) {
        List<String> found = new ArrayList<>();
        Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
            found.add(matcher.group(1));
        }
        return found;
    }
}
