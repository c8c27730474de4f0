package com.pypeek.core.ast;

/**
 * Common interface for source-to-syntax-tree parsers.
 *
 * <p>The summarizer only needs one language, but keeps the parser behind this seam so the
 * tree walker never sees the parsing technology. The {@link AstParserFactory} provides the
 * parser instance.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * AstParser<PythonAst.Module> parser = AstParserFactory.getPythonParser();
 * PythonAst.Module module = parser.parseString(source);
 *
 * for (PythonAst.Statement statement : module.body()) {
 *     System.out.println(statement);
 * }
 * }</pre>
 *
 * @param <T> the root node type returned by this parser
 * @see AstParserFactory
 * @since 1.0.0
 */
public interface AstParser<T> {

    /**
     * Parses a string of source code.
     *
     * @param sourceCode source code to parse
     * @return root of the syntax tree
     * @throws AstParseException if the source is malformed
     */
    T parseString(String sourceCode) throws AstParseException;

    /**
     * Checks if this parser is available (i.e., required dependencies are present).
     *
     * @return true if parser is available, false otherwise
     */
    boolean isAvailable();

    /**
     * Gets the language this parser supports.
     *
     * @return language identifier (e.g., "python")
     */
    String getLanguage();

    /**
     * Exception thrown when parsing fails.
     *
     * <p>Carries the 1-indexed line and column of the offending input when the parser
     * knows them, {@code 0} otherwise.
     */
    class AstParseException extends RuntimeException {

        private final int line;
        private final int column;

        public AstParseException(String message, int line, int column) {
            super(message);
            this.line = line;
            this.column = column;
        }

        public AstParseException(String message, Throwable cause) {
            super(message, cause);
            this.line = 0;
            this.column = 0;
        }

        public AstParseException(String message) {
            this(message, 0, 0);
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }
}
