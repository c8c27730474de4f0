package com.pypeek.core.parser.python;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Recovers the source text of a parsed expression.
 *
 * <p>The text is rebuilt from the expression's tokens with the original spacing between
 * them, except that any gap containing a line break (a continuation line, a comment inside
 * brackets) becomes a single space. The result is {@code null} when the expression was not
 * parsed cleanly.
 */
final class ExpressionText {

    private ExpressionText() {
        // Utility class
    }

    static String of(ParserRuleContext ctx, TokenStream tokens) {
        if (ctx == null || ctx.exception != null) {
            return null;
        }

        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        if (start == null || stop == null || stop.getTokenIndex() < start.getTokenIndex()) {
            return null;
        }

        CharStream input = start.getInputStream();
        if (input == null) {
            return null;
        }

        StringBuilder text = new StringBuilder();
        Token previous = null;
        for (int i = start.getTokenIndex(); i <= stop.getTokenIndex(); i++) {
            Token token = tokens.get(i);
            if (token.getChannel() != Token.DEFAULT_CHANNEL || token.getType() == Token.EOF) {
                continue;
            }
            if (previous != null && token.getStartIndex() > previous.getStopIndex() + 1) {
                String gap = input.getText(Interval.of(previous.getStopIndex() + 1, token.getStartIndex() - 1));
                text.append(gap.indexOf('\n') >= 0 || gap.indexOf('\r') >= 0 ? " " : gap);
            }
            text.append(token.getText());
            previous = token;
        }

        String result = text.toString().strip();
        return result.isEmpty() ? null : result;
    }
}
