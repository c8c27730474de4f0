package com.pypeek.parser;

import java.util.ArrayDeque;
import java.util.Deque;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

/**
 * Base class for the Python lexer.
 *
 * <p>Python delimits blocks by indentation, which a context-free lexer cannot express.
 * This base class post-processes the {@code NEWLINE} rule: it drops newlines that do
 * not end a logical line (inside brackets, before blank and comment-only lines) and
 * turns indentation changes into {@code INDENT} / {@code DEDENT} tokens. At end of
 * input it closes the last logical line and every open block.
 *
 * <p>A dedent to a column that no enclosing block uses, and indentation whose order depends
 * on how wide a tab is, are reported to the error listeners as indentation errors.
 */
public abstract class PythonLexerBase extends Lexer {

    private static final int TAB_SIZE = 8;

    static final String INCONSISTENT_DEDENT = "unindent does not match any outer indentation level";
    static final String INCONSISTENT_TABS = "inconsistent use of tabs and spaces in indentation";

    private final Deque<Token> pending = new ArrayDeque<>();
    // Open block columns, with tabs expanded to 8 and with tabs counted as 1.
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Integer> altIndents = new ArrayDeque<>();
    private int opened;
    private int lastEmittedType = Token.INVALID_TYPE;
    private boolean started;
    private boolean eofHandled;

    protected PythonLexerBase(CharStream input) {
        super(input);
    }

    @Override
    public void emit(Token token) {
        super.setToken(token);
        pending.offer(token);
        if (token.getType() != Token.EOF && token.getChannel() == Token.DEFAULT_CHANNEL) {
            lastEmittedType = token.getType();
        }
    }

    @Override
    public Token nextToken() {
        if (!started) {
            started = true;
            indentFirstLine();
            if (!pending.isEmpty()) {
                return pending.poll();
            }
        }

        Token next = super.nextToken();

        if (next.getType() == Token.EOF && !eofHandled) {
            eofHandled = true;
            pending.removeIf(token -> token.getType() == Token.EOF);

            if (endsLogicalLine()) {
                emit(syntheticToken(PythonLexer.NEWLINE, "\n"));
            }
            while (!indents.isEmpty()) {
                indents.pop();
                altIndents.pop();
                emit(syntheticToken(PythonLexer.DEDENT, ""));
            }
            emit(new CommonToken(_tokenFactorySourcePair, Token.EOF, DEFAULT_TOKEN_CHANNEL,
                getCharIndex(), getCharIndex() - 1));
        }

        return pending.isEmpty() ? next : pending.poll();
    }

    @Override
    public void reset() {
        super.reset();
        pending.clear();
        indents.clear();
        altIndents.clear();
        opened = 0;
        lastEmittedType = Token.INVALID_TYPE;
        started = false;
        eofHandled = false;
    }

    protected void openBracket() {
        opened++;
    }

    protected void closeBracket() {
        if (opened > 0) {
            opened--;
        }
    }

    /**
     * Action of the {@code NEWLINE} rule. The matched text is one line break followed
     * by the leading whitespace of the next physical line.
     */
    protected void onNewLine() {
        int next = _input.LA(1);
        if (opened > 0 || next == '\r' || next == '\n' || next == '#') {
            skip();
            return;
        }

        boolean emitted = false;
        if (endsLogicalLine()) {
            CommonToken newline = new CommonToken(_tokenFactorySourcePair, PythonLexer.NEWLINE,
                DEFAULT_TOKEN_CHANNEL, _tokenStartCharIndex, _tokenStartCharIndex);
            newline.setLine(_tokenStartLine);
            newline.setCharPositionInLine(_tokenStartCharPositionInLine);
            newline.setText("\n");
            emit(newline);
            emitted = true;
        }

        if (next != EOF) {
            String spaces = getText().replaceAll("[\r\n]", "");
            int line = _tokenStartLine + 1;
            int indent = indentationOf(spaces, TAB_SIZE);
            int altIndent = indentationOf(spaces, 1);

            if (indent > currentIndent()) {
                if (altIndent <= currentAltIndent()) {
                    reportIndentationError(INCONSISTENT_TABS, line, spaces.length());
                }
                indents.push(indent);
                altIndents.push(altIndent);
                emit(syntheticToken(PythonLexer.INDENT, spaces));
                emitted = true;
            } else {
                while (!indents.isEmpty() && indents.peek() > indent) {
                    indents.pop();
                    altIndents.pop();
                    emit(syntheticToken(PythonLexer.DEDENT, ""));
                    emitted = true;
                }
                if (indent != currentIndent()) {
                    reportIndentationError(INCONSISTENT_DEDENT, line, spaces.length());
                } else if (altIndent != currentAltIndent()) {
                    reportIndentationError(INCONSISTENT_TABS, line, spaces.length());
                }
            }
        }

        if (!emitted) {
            skip();
        }
    }

    /**
     * Action of the {@code FORMATTED_STRING} rule, which matches only the prefix and the opening
     * quote. Consumes the rest of the literal, including replacement fields that contain
     * strings delimited by the same quote, and retypes the token as {@code STRING}. An
     * unterminated literal becomes an {@code ERROR_CHAR} token.
     */
    protected void onFormattedString() {
        String text = getText();
        int quoteStart = 0;
        while (Character.isLetter(text.charAt(quoteStart))) {
            quoteStart++;
        }
        boolean closed = consumeStringBody(text.substring(quoteStart), true);
        setType(closed ? PythonLexer.STRING : PythonLexer.ERROR_CHAR);
    }

    private boolean consumeStringBody(String quote, boolean formatted) {
        boolean triple = quote.length() == 3;
        int depth = 0;
        StringBuilder word = new StringBuilder();

        while (true) {
            int c = _input.LA(1);
            if (c == EOF) {
                return false;
            }

            if (depth == 0) {
                if (c == '\\') {
                    consumeChars(_input.LA(2) == EOF ? 1 : 2);
                } else if (c == quote.charAt(0) && closesWith(quote)) {
                    consumeChars(quote.length());
                    return true;
                } else if (!triple && (c == '\n' || c == '\r')) {
                    return false;
                } else if (formatted && c == '{' && _input.LA(2) != '{') {
                    depth++;
                    word.setLength(0);
                    consumeChars(1);
                } else {
                    consumeChars(c == '{' && formatted ? 2 : 1);
                }
                continue;
            }

            // Inside a replacement field
            if (c == '\'' || c == '"') {
                String prefix = word.toString();
                boolean nestedFormatted = prefix.length() <= 2 && (prefix.indexOf('f') >= 0 || prefix.indexOf('F') >= 0);
                if (!consumeStringBody(openingQuote((char) c), nestedFormatted)) {
                    return false;
                }
                word.setLength(0);
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
            if (Character.isLetterOrDigit(c) || c == '_') {
                word.appendCodePoint(c);
            } else {
                word.setLength(0);
            }
            consumeChars(1);
        }
    }

    private String openingQuote(char quoteChar) {
        String triple = String.valueOf(quoteChar).repeat(3);
        String quote = closesWith(triple) ? triple : String.valueOf(quoteChar);
        consumeChars(quote.length());
        return quote;
    }

    private boolean closesWith(String quote) {
        for (int i = 0; i < quote.length(); i++) {
            if (_input.LA(i + 1) != quote.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private void consumeChars(int count) {
        for (int i = 0; i < count; i++) {
            getInterpreter().consume(_input);
        }
    }

    /**
     * The first physical line has no preceding {@code NEWLINE} to measure it, so leading
     * whitespace there is turned into an {@code INDENT} up front, which the parser rejects.
     */
    private void indentFirstLine() {
        int length = 0;
        while (_input.LA(length + 1) == ' ' || _input.LA(length + 1) == '\t') {
            length++;
        }
        int first = _input.LA(length + 1);
        if (length == 0 || first == EOF || first == '\r' || first == '\n' || first == '#') {
            return;
        }

        StringBuilder spaces = new StringBuilder();
        for (int i = 1; i <= length; i++) {
            spaces.append((char) _input.LA(i));
        }
        indents.push(indentationOf(spaces.toString(), TAB_SIZE));
        altIndents.push(indentationOf(spaces.toString(), 1));

        CommonToken indent = new CommonToken(_tokenFactorySourcePair, PythonLexer.INDENT,
            DEFAULT_TOKEN_CHANNEL, 0, length - 1);
        indent.setText(spaces.toString());
        indent.setLine(1);
        indent.setCharPositionInLine(0);
        emit(indent);
    }

    private void reportIndentationError(String message, int line, int column) {
        getErrorListenerDispatch().syntaxError(this, null, line, column, message, null);
    }

    private int currentIndent() {
        return indents.isEmpty() ? 0 : indents.peek();
    }

    private int currentAltIndent() {
        return altIndents.isEmpty() ? 0 : altIndents.peek();
    }

    private boolean endsLogicalLine() {
        return lastEmittedType != Token.INVALID_TYPE
            && lastEmittedType != PythonLexer.NEWLINE
            && lastEmittedType != PythonLexer.INDENT
            && lastEmittedType != PythonLexer.DEDENT;
    }

    private CommonToken syntheticToken(int type, String text) {
        int stop = getCharIndex() - 1;
        int start = text.isEmpty() ? stop : stop - text.length() + 1;
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL, start, stop);
        token.setText(text);
        return token;
    }

    private static int indentationOf(String whitespace, int tabSize) {
        int count = 0;
        for (char c : whitespace.toCharArray()) {
            if (c == '\t') {
                count += tabSize - (count % tabSize);
            } else if (c == '\f') {
                count = 0;
            } else {
                count++;
            }
        }
        return count;
    }
}
