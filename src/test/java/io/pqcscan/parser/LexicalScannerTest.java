package io.pqcscan.parser;

import io.pqcscan.model.Language;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LexicalScannerTest {

    private static List<LexicalScanner.LexedLine> scan(Language language, String... lines) {
        return new LexicalScanner(LanguageSyntax.forLanguage(language)).scan(List.of(lines));
    }

    @Test
    void blockComment_spansLines() {
        List<LexicalScanner.LexedLine> lexed = scan(Language.JAVA,
                "/* RSA", " * still comment", " */ int x = 1;");

        assertThat(lexed.get(0).comment()).isTrue();
        assertThat(lexed.get(1).comment()).isTrue();
        assertThat(lexed.get(2).comment()).isFalse();
        assertThat(lexed.get(2).code()).contains("int x = 1;").doesNotContain("*/");
    }

    @Test
    void commentMarkerInsideString_isCode() {
        List<LexicalScanner.LexedLine> lexed = scan(Language.JAVASCRIPT, "const url = \"http://example.com\";");

        assertThat(lexed.get(0).comment()).isFalse();
        assertThat(lexed.get(0).code()).contains("example.com");
        assertThat(lexed.get(0).literals()).containsExactly(new TextSpan(12, 32));
    }

    @Test
    void escapedQuote_doesNotCloseString() {
        List<LexicalScanner.LexedLine> lexed = scan(Language.PYTHON, "s = 'it\\'s # not comment'");

        assertThat(lexed.get(0).code()).contains("# not comment");
        assertThat(lexed.get(0).literals()).hasSize(1);
    }

    @Test
    void unterminatedSingleLineString_closesAtEndOfLine() {
        List<LexicalScanner.LexedLine> lexed = scan(Language.C_FAMILY, "let s = \"oops", "// RSA");

        assertThat(lexed.get(0).literals()).containsExactly(new TextSpan(8, 13));
        assertThat(lexed.get(1).comment()).isTrue();
    }

    @Test
    void rustLifetimes_stayCode() {
        List<LexicalScanner.LexedLine> lexed = scan(Language.C_FAMILY,
                "fn sign<'a>(msg: &'static str, key: &'a [u8]) -> Vec<u8> {",
                "    'outer: loop { break 'outer; }");

        assertThat(lexed.get(0).literals()).isEmpty();
        assertThat(lexed.get(0).code()).endsWith("{");
        assertThat(lexed.get(1).literals()).isEmpty();
    }

    @Test
    void charLiterals_closeAfterOneCharacterOrEscape() {
        List<LexicalScanner.LexedLine> lexed = scan(Language.C_FAMILY,
                "let c = 'x'; let n = '\\n'; let e = '\\u{1F600}';");

        assertThat(lexed.get(0).literals())
                .containsExactly(new TextSpan(8, 11), new TextSpan(21, 25), new TextSpan(35, 46));
    }

    @Test
    void pythonTripleQuote_spansLinesAsString() {
        List<LexicalScanner.LexedLine> lexed = scan(Language.PYTHON, "x = \"\"\"first", "# inside", "end\"\"\"");

        assertThat(lexed.get(1).comment()).isFalse();
        assertThat(lexed.get(1).literals()).hasSize(1);
    }

    @Test
    void goRawString_ignoresBackslash() {
        List<LexicalScanner.LexedLine> lexed = scan(Language.GO, "p := `C:\\`; // md5");

        assertThat(lexed.get(0).code()).doesNotContain("md5");
        assertThat(lexed.get(0).literals()).containsExactly(new TextSpan(5, 10));
    }

    @Test
    void plainSyntax_hasNoComments() {
        List<LexicalScanner.LexedLine> lexed = scan(Language.UNKNOWN, "# md5", "// rsa");

        assertThat(lexed).noneMatch(LexicalScanner.LexedLine::comment);
        assertThat(lexed.get(0).code()).isEqualTo("# md5");
    }
}
