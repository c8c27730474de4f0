package com.pypeek.core.ast;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pypeek.core.util.Languages;

/**
 * Factory for creating language-specific parsers.
 *
 * <p>Parser instances are created on-demand and reused across summarizer invocations.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * AstParser<PythonAst.Module> pythonParser = AstParserFactory.getPythonParser();
 * if (pythonParser.isAvailable()) {
 *     PythonAst.Module module = pythonParser.parseString(source);
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b></p>
 * <p>This factory is thread-safe. Parser instances are cached in a {@link ConcurrentHashMap}
 * and initialized only once per language.</p>
 *
 * @see AstParser
 * @see PythonAst
 * @since 1.0.0
 */
public final class AstParserFactory {

    private static final Logger log = LoggerFactory.getLogger(AstParserFactory.class);

    private static final String PYTHON_PARSER_CLASS = "com.pypeek.core.parser.python.PythonAstParser";

    // Cache of parser instances (one per language)
    private static final Map<String, AstParser<?>> parserCache = new ConcurrentHashMap<>();

    private AstParserFactory() {
        // Utility class - no instantiation
    }

    /**
     * Gets the Python parser (ANTLR Python 3 grammar).
     *
     * @return Python parser instance (cached, thread-safe)
     */
    @SuppressWarnings("unchecked")
    public static AstParser<PythonAst.Module> getPythonParser() {
        return (AstParser<PythonAst.Module>) parserCache.computeIfAbsent(Languages.PYTHON, lang ->
            createParser(PYTHON_PARSER_CLASS, "Python")
        );
    }

    /**
     * Helper method to create parser instances via reflection.
     *
     * @param className fully qualified class name
     * @param displayName display name for logging
     * @return parser instance
     * @throws IllegalStateException if parser cannot be created
     */
    private static AstParser<?> createParser(String className, String displayName) {
        try {
            Class<?> implClass = Class.forName(className);
            AstParser<?> parser = (AstParser<?>) implClass.getDeclaredConstructor().newInstance();
            log.debug("{} parser initialized", displayName);
            return parser;
        } catch (ClassNotFoundException e) {
            log.warn("{} parser not available: {}", displayName, e.getMessage());
            throw new IllegalStateException(displayName + " parser not available", e);
        } catch (ReflectiveOperationException e) {
            log.error("{} parser failed to initialize", displayName, e);
            throw new IllegalStateException(displayName + " parser failed to initialize", e);
        }
    }
}
