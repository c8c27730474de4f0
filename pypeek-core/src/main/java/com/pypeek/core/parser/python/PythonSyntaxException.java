package com.pypeek.core.parser.python;

import com.pypeek.core.ast.AstParser;

/**
 * Malformed Python source. Raised for the first syntax error the parser meets.
 */
public class PythonSyntaxException extends AstParser.AstParseException {

    /**
     * @param message human-readable description (e.g., "invalid syntax near ':'")
     * @param line 1-indexed line of the offending token
     * @param column 1-indexed column of the offending token
     */
    public PythonSyntaxException(String message, int line, int column) {
        super(message, line, column);
    }
}
