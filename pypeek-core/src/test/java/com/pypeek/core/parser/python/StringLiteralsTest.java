package com.pypeek.core.parser.python;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

class StringLiteralsTest {

    @Test
    void testQuotesAreRemoved() {
        assertThat(StringLiterals.evaluate(List.of("'single'"))).isEqualTo("single");
        assertThat(StringLiterals.evaluate(List.of("\"double\""))).isEqualTo("double");
        assertThat(StringLiterals.evaluate(List.of("'''triple\nline'''"))).isEqualTo("triple\nline");
        assertThat(StringLiterals.evaluate(List.of("\"\"\"\"\"\""))).isEmpty();
    }

    @Test
    void testAdjacentLiteralsAreConcatenated() {
        assertThat(StringLiterals.evaluate(List.of("'a'", "\"b\"", "u'c'"))).isEqualTo("abc");
    }

    @Test
    void testBytesAndFormattedLiteralsHaveNoValue() {
        assertThat(StringLiterals.evaluate(List.of("b'raw'"))).isNull();
        assertThat(StringLiterals.evaluate(List.of("F'{x}'"))).isNull();
        assertThat(StringLiterals.evaluate(List.of("'plain'", "rb'mixed'"))).isNull();
    }

    @Test
    void testSimpleEscapes() {
        assertThat(StringLiterals.unescape("tab\\there")).isEqualTo("tab\there");
        assertThat(StringLiterals.unescape("line\\nbreak")).isEqualTo("line\nbreak");
        assertThat(StringLiterals.unescape("quote\\'s \\\"q\\\"")).isEqualTo("quote's \"q\"");
        assertThat(StringLiterals.unescape("back\\\\slash")).isEqualTo("back\\slash");
        assertThat(StringLiterals.unescape("joined\\\nline")).isEqualTo("joinedline");
    }

    @Test
    void testNumericEscapes() {
        assertThat(StringLiterals.unescape("\\x41\\101\\u00e9\\U0001F600"))
            .isEqualTo("AA\u00e9" + new String(Character.toChars(0x1F600)));
        assertThat(StringLiterals.unescape("\\0")).isEqualTo("\0");
    }

    @Test
    void testNamedEscape() {
        assertThat(StringLiterals.unescape("\\N{BULLET}")).isEqualTo("\u2022");
        assertThat(StringLiterals.unescape("\\N{NO SUCH CHARACTER NAME}")).isEqualTo("\\N{NO SUCH CHARACTER NAME}");
    }

    @Test
    void testUnknownEscapesAreKept() {
        assertThat(StringLiterals.unescape("C:\\path\\d")).isEqualTo("C:\\path\\d");
    }

    @Test
    void testRawLiteralsAreNotUnescaped() {
        assertThat(StringLiterals.evaluate(List.of("r'\\d+\\n'"))).isEqualTo("\\d+\\n");
        assertThat(StringLiterals.evaluate(List.of("R\"\\x41\""))).isEqualTo("\\x41");
    }
}
