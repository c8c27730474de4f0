package com.pypeek.core.parser.python;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

import com.pypeek.core.ast.AstParser;
import com.pypeek.core.ast.PythonAst;
import com.pypeek.core.util.Languages;
import com.pypeek.parser.PythonLexer;
import com.pypeek.parser.PythonParser;

/**
 * Parses Python source into a {@link PythonAst.Module} using the ANTLR Python 3 grammar.
 *
 * <p>Parsing stops at the first syntax error, which is reported as a
 * {@link PythonSyntaxException} carrying the 1-indexed line and column of the offending
 * token. There is no partial tree and no recovery.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PythonAst.Module module = new PythonAstParser().parseString(source);
 * for (PythonAst.Statement statement : module.body()) {
 *     System.out.println(statement);
 * }
 * }</pre>
 *
 * <p>Instances hold no state between calls and may be shared.
 *
 * @since 1.0.0
 */
public class PythonAstParser implements AstParser<PythonAst.Module> {

    @Override
    public PythonAst.Module parseString(String sourceCode) {
        CharStream input = CharStreams.fromString(sourceCode);

        PythonLexer lexer = new PythonLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        PythonParser parser = new PythonParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        PythonParser.File_inputContext tree = parser.file_input();
        return new PythonTreeBuilder(tokens).build(tree);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String getLanguage() {
        return Languages.PYTHON;
    }

    /**
     * Turns the first reported lexer or parser error into a {@link PythonSyntaxException}.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        private static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new PythonSyntaxException(describe(recognizer, offendingSymbol, msg), line, charPositionInLine + 1);
        }

        private static String describe(Recognizer<?, ?> recognizer, Object offendingSymbol, String antlrMessage) {
            if (!(offendingSymbol instanceof Token token)) {
                return antlrMessage;
            }

            if (expectsIndent(recognizer) && token.getType() != PythonLexer.INDENT) {
                return "expected an indented block";
            }

            return switch (token.getType()) {
                case PythonLexer.INDENT -> "unexpected indent";
                case PythonLexer.DEDENT -> "unindent does not match any outer indentation level";
                case Token.EOF -> "unexpected EOF while parsing";
                case PythonLexer.ERROR_CHAR -> opensString(token.getText())
                    ? "unterminated string literal"
                    : "invalid character '" + token.getText() + "'";
                case PythonLexer.NEWLINE -> "invalid syntax at end of line";
                default -> "invalid syntax near '" + token.getText() + "'";
            };
        }

        private static boolean expectsIndent(Recognizer<?, ?> recognizer) {
            return recognizer instanceof Parser parser
                && parser.getState() >= 0
                && parser.getContext() != null
                && parser.getExpectedTokens().contains(PythonLexer.INDENT);
        }

        private static boolean opensString(String text) {
            return text.indexOf('\'') >= 0 || text.indexOf('"') >= 0;
        }
    }
}
