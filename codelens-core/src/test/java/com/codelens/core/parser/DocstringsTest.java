package com.codelens.core.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Docstrings}.
 */
class DocstringsTest {

    @Test
    void clean_indentedBody_removesCommonMargin() {
        String cleaned = Docstrings.clean("""
            Summary line.

                    Details indented.
                        Nested.
                    """);

        assertThat(cleaned).isEqualTo("Summary line.\n\nDetails indented.\n    Nested.");
    }

    @Test
    void clean_leadingAndTrailingBlankLines_areRemoved() {
        assertThat(Docstrings.clean("\n\n   Text\n\n")).isEqualTo("Text");
    }

    @Test
    void decodeLiteral_escapes_areDecoded() {
        assertThat(Docstrings.decodeLiteral("\"tab\\there\\n\\x41\\u00e9\"")).isEqualTo("tab\there\nAé");
    }

    @Test
    void decodeLiteral_namedEscape_isDecodedByUnicodeName() {
        assertThat(Docstrings.decodeLiteral("'Amount in \\N{EURO SIGN}'")).isEqualTo("Amount in \u20AC");
    }

    @Test
    void decodeLiteral_unknownNamedEscape_keepsText() {
        assertThat(Docstrings.decodeLiteral("'\\N{NO SUCH CHARACTER} and \\N'"))
            .isEqualTo("\\N{NO SUCH CHARACTER} and \\N");
    }

    @Test
    void decodeLiteral_rawString_keepsBackslashes() {
        assertThat(Docstrings.decodeLiteral("r'''C:\\path\\n'''")).isEqualTo("C:\\path\\n");
    }

    @Test
    void decodeLiteral_malformedEscape_keepsText() {
        assertThat(Docstrings.decodeLiteral("'bad \\xZZ'")).isEqualTo("bad \\xZZ");
    }

    @Test
    void decodeLiteral_bytesAndFormatStrings_areNotDocstrings() {
        assertThat(Docstrings.decodeLiteral("b'data'")).isNull();
        assertThat(Docstrings.decodeLiteral("f\"{value}\"")).isNull();
    }

    @Test
    void parse_bytesDocstring_isIgnored() {
        var analysis = new PythonSourceParser().parseSource("""
            def f():
                b\"\"\"not a docstring\"\"\"
            """, "f.py");

        assertThat(analysis.functions().get(0).docstring()).isNull();
    }
}
