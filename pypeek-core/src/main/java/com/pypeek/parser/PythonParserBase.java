package com.pypeek.parser;

import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;

/**
 * Base class for the Python parser with helpers for soft keywords.
 *
 * <p>{@code match}, {@code case} and {@code type} are ordinary names everywhere except at the
 * start of a {@code match} statement, a {@code case} block or a type alias statement, so the
 * grammar matches them as {@code NAME} tokens guarded by {@link #nextTokenIs(String)}.
 */
public abstract class PythonParserBase extends Parser {

    protected PythonParserBase(TokenStream input) {
        super(input);
    }

    /**
     * Checks whether the next token matches the given text.
     */
    protected boolean nextTokenIs(String text) {
        Token nextToken = _input.LT(1);
        return nextToken != null && nextToken.getText().equals(text);
    }
}
