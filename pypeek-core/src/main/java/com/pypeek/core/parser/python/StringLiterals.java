package com.pypeek.core.parser.python;

import java.util.List;
import java.util.Locale;

/**
 * Evaluates Python string literal tokens.
 *
 * <p>Only plain {@code str} literals have a value here: a literal sequence containing a
 * bytes or f-string piece evaluates to {@code null}, matching what Python accepts as a
 * docstring. Adjacent literals are concatenated. Escape sequences are processed unless the
 * piece is raw.
 */
final class StringLiterals {

    private static final String TRIPLE_DOUBLE = "\"\"\"";
    private static final String TRIPLE_SINGLE = "'''";

    private StringLiterals() {
        // Utility class
    }

    /**
     * @param tokens literal tokens as written, prefixes and quotes included
     * @return the concatenated value, or {@code null} if any piece is bytes or an f-string
     */
    static String evaluate(List<String> tokens) {
        StringBuilder value = new StringBuilder();
        for (String token : tokens) {
            int quote = firstQuote(token);
            if (quote < 0) {
                return null;
            }

            String prefix = token.substring(0, quote).toLowerCase(Locale.ROOT);
            if (prefix.indexOf('b') >= 0 || prefix.indexOf('f') >= 0) {
                return null;
            }

            String quoted = token.substring(quote);
            int delimiter = quoted.startsWith(TRIPLE_DOUBLE) || quoted.startsWith(TRIPLE_SINGLE) ? 3 : 1;
            if (quoted.length() < 2 * delimiter) {
                return null;
            }
            String body = quoted.substring(delimiter, quoted.length() - delimiter);

            value.append(prefix.indexOf('r') >= 0 ? body : unescape(body));
        }
        return value.toString();
    }

    private static int firstQuote(String token) {
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c == '\'' || c == '"') {
                return i;
            }
        }
        return -1;
    }

    static String unescape(String body) {
        StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }

            char next = body.charAt(i + 1);
            switch (next) {
                case '\n' -> i += 2;
                case '\\' -> { out.append('\\'); i += 2; }
                case '\'' -> { out.append('\''); i += 2; }
                case '"' -> { out.append('"'); i += 2; }
                case 'a' -> { out.append('\u0007'); i += 2; }
                case 'b' -> { out.append('\b'); i += 2; }
                case 'f' -> { out.append('\f'); i += 2; }
                case 'n' -> { out.append('\n'); i += 2; }
                case 'r' -> { out.append('\r'); i += 2; }
                case 't' -> { out.append('\t'); i += 2; }
                case 'v' -> { out.append('\u000B'); i += 2; }
                case 'x' -> i = appendHex(body, i, 2, out);
                case 'u' -> i = appendHex(body, i, 4, out);
                case 'U' -> i = appendHex(body, i, 8, out);
                case 'N' -> i = appendNamed(body, i, out);
                default -> {
                    if (next >= '0' && next <= '7') {
                        i = appendOctal(body, i, out);
                    } else {
                        // Unknown escapes are kept as written.
                        out.append('\\').append(next);
                        i += 2;
                    }
                }
            }
        }
        return out.toString();
    }

    private static int appendHex(String body, int backslash, int digits, StringBuilder out) {
        int start = backslash + 2;
        int end = start + digits;
        if (end > body.length()) {
            out.append(body, backslash, body.length());
            return body.length();
        }
        String hex = body.substring(start, end);
        if (!hex.chars().allMatch(ch -> Character.digit(ch, 16) >= 0)) {
            out.append(body, backslash, start);
            return start;
        }
        int codePoint = Integer.parseInt(hex, 16);
        if (!Character.isValidCodePoint(codePoint)) {
            out.append(body, backslash, end);
            return end;
        }
        out.appendCodePoint(codePoint);
        return end;
    }

    private static int appendOctal(String body, int backslash, StringBuilder out) {
        int start = backslash + 1;
        int end = start;
        while (end < body.length() && end < start + 3 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
            end++;
        }
        out.appendCodePoint(Integer.parseInt(body.substring(start, end), 8));
        return end;
    }

    private static int appendNamed(String body, int backslash, StringBuilder out) {
        int open = backslash + 2;
        int close = body.indexOf('}', open);
        if (open >= body.length() || body.charAt(open) != '{' || close < 0) {
            out.append(body, backslash, open);
            return open;
        }
        String name = body.substring(open + 1, close);
        try {
            out.appendCodePoint(Character.codePointOf(name));
        } catch (IllegalArgumentException e) {
            out.append(body, backslash, close + 1);
        }
        return close + 1;
    }
}
