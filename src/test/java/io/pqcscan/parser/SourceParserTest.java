package io.pqcscan.parser;

import io.pqcscan.Samples;
import io.pqcscan.model.Language;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceParserTest {

    private SourceParser parser;

    @BeforeEach
    void setUp() {
        parser = new SourceParser();
    }

    @Test
    void parse_emptyContentHasNoLines() throws Exception {
        ParsedFile parsed = parser.parse("", "test.py");

        assertThat(parsed.lines()).isEmpty();
        assertThat(parsed.language()).isEqualTo(Language.PYTHON);
        assertThat(parsed.degraded()).isFalse();
    }

    @Test
    void parse_splitsAllLineTerminators() throws Exception {
        ParsedFile parsed = parser.parse("a\r\nb\rc\nd", "x.go");

        assertThat(parsed.lines()).extracting(SourceLine::text).containsExactly("a", "b", "c", "d");
        assertThat(parsed.lines()).extracting(SourceLine::number).containsExactly(1, 2, 3, 4);
    }

    @Test
    void parse_trailingNewlineDoesNotAddLine() throws Exception {
        assertThat(parser.parse("a\n", "x.py").lineCount()).isEqualTo(1);
        assertThat(parser.parse("a\n\n", "x.py").lineCount()).isEqualTo(2);
    }

    @Test
    void parse_invalidUtf8DegradesInsteadOfFailing() throws Exception {
        byte[] content = {(byte) 0xFF, (byte) 0xFE, 'm', 'd', '5', '\n', 'x', ' ', '=', ' ', '1'};

        ParsedFile parsed = parser.parse(content, "broken.py");

        assertThat(parsed.lines()).hasSize(2);
        assertThat(parsed.degraded()).isTrue();
        assertThat(parsed.lines().get(0).text()).endsWith("md5");
    }

    @Test
    void parse_stripsUtf8Bom() throws Exception {
        byte[] content = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'i', 'm', 'p', 'o', 'r', 't', ' ', 'o', 's'};

        ParsedFile parsed = parser.parse(content, "a.py");

        assertThat(parsed.lines().get(0).text()).isEqualTo("import os");
        assertThat(parsed.imports()).extracting(ImportRef::module).containsExactly("os");
    }

    @Test
    void parse_unknownLanguageIsDegradedButKeepsLines() throws Exception {
        ParsedFile parsed = parser.parse("RSA\n# not a comment here", "notes.txt");

        assertThat(parsed.language()).isEqualTo(Language.UNKNOWN);
        assertThat(parsed.degraded()).isTrue();
        assertThat(parsed.lines()).noneMatch(SourceLine::comment);
        assertThat(parsed.imports()).isEmpty();
        assertThat(parsed.functions()).isEmpty();
    }

    @Test
    void parse_rejectsOversizedContent() {
        SourceParser small = new SourceParser(10);

        assertThatThrownBy(() -> small.parse("x".repeat(11), "a.py"))
                .isInstanceOf(SourceParseException.class)
                .satisfies(e -> assertThat(((SourceParseException) e).reason())
                        .isEqualTo(SourceParseException.Reason.INPUT_TOO_LARGE));
    }

    @Test
    void parse_sizeLimitCountsUtf8Bytes() throws Exception {
        SourceParser small = new SourceParser(4);
        String twoChars = "\u00e9\u00e9"; // 4 bytes in UTF-8

        assertThat(small.parse(twoChars, "a.py").lineCount()).isEqualTo(1);
        assertThatThrownBy(() -> small.parse(twoChars + "a", "a.py"))
                .isInstanceOf(SourceParseException.class);
        assertThat("\u00e9\u00e9".getBytes(StandardCharsets.UTF_8)).hasSize(4);
    }

    @Test
    void parse_marksCommentLinesButKeepsText() throws Exception {
        ParsedFile parsed = parser.parse("# md5 is bad\nx = 1  # rsa\n", "a.py");

        SourceLine first = parsed.lines().get(0);
        SourceLine second = parsed.lines().get(1);
        assertThat(first.comment()).isTrue();
        assertThat(first.text()).isEqualTo("# md5 is bad");
        assertThat(second.comment()).isFalse();
        assertThat(second.code()).doesNotContain("rsa").hasSameSizeAs(second.text());
    }

    @Test
    void parse_hashInsidePythonStringIsNotAComment() throws Exception {
        ParsedFile parsed = parser.parse("s = \"#rsa\"", "a.py");

        assertThat(parsed.lines().get(0).code()).contains("#rsa");
        assertThat(parsed.lines().get(0).stringLiterals()).hasSize(1);
    }

    @Test
    void parse_recordsIndentation() throws Exception {
        ParsedFile parsed = parser.parse("def f():\n    x = 1\n\ty = 2", "a.py");

        assertThat(parsed.lines()).extracting(SourceLine::indent).containsExactly(0, 4, 4);
    }

    // ---- Imports ----

    @Test
    void imports_python() throws Exception {
        ParsedFile parsed = parser.parse(Samples.read("crypto_sample.py"), "crypto_sample.py");

        assertThat(parsed.imports()).extracting(ImportRef::module).containsExactly(
                "hashlib", "random", "cryptography.hazmat.primitives.asymmetric", "Crypto.Cipher");
        assertThat(parsed.imports()).extracting(ImportRef::line).containsExactly(1, 2, 3, 4);
    }

    @Test
    void imports_pythonAliasesAndLists() throws Exception {
        ParsedFile parsed = parser.parse("import os, hashlib as h\nfrom . import util", "a.py");

        assertThat(parsed.imports()).extracting(ImportRef::module).containsExactly("os", "hashlib", ".");
    }

    @Test
    void imports_javascriptRequireAndImport() throws Exception {
        ParsedFile parsed = parser.parse(Samples.read("crypto_sample.js"), "crypto_sample.js");

        assertThat(parsed.imports()).extracting(ImportRef::module).containsExactly("crypto", "jsonwebtoken");
    }

    @Test
    void imports_goBlock() throws Exception {
        ParsedFile parsed = parser.parse(Samples.read("crypto_sample.go"), "crypto_sample.go");

        assertThat(parsed.imports()).extracting(ImportRef::module).containsExactly(
                "crypto/ecdsa", "crypto/elliptic", "crypto/md5", "crypto/rand", "crypto/rsa", "fmt");
        assertThat(parsed.imports().get(0).line()).isEqualTo(4);
    }

    @Test
    void imports_goSingleLine() throws Exception {
        ParsedFile parsed = parser.parse("import \"crypto/sha1\"\nimport m \"math/rand\"", "a.go");

        assertThat(parsed.imports()).extracting(ImportRef::module).containsExactly("crypto/sha1", "math/rand");
    }

    @Test
    void imports_java() throws Exception {
        ParsedFile parsed = parser.parse(Samples.read("CryptoSample.java"), "CryptoSample.java");

        assertThat(parsed.imports()).extracting(ImportRef::module).containsExactly(
                "java.security.KeyPairGenerator", "java.security.MessageDigest",
                "javax.crypto.Cipher", "javax.net.ssl.SSLContext");
    }

    @Test
    void imports_cFamily() throws Exception {
        ParsedFile parsed = parser.parse(
                "#include <openssl/rsa.h>\nusing System.Security.Cryptography;\nextern crate ring;", "a.c");

        assertThat(parsed.imports()).extracting(ImportRef::module)
                .containsExactly("openssl/rsa.h", "System.Security.Cryptography", "ring");
    }

    @Test
    void imports_commentedOutImportIgnored() throws Exception {
        ParsedFile parsed = parser.parse("// import java.security.KeyPair;\nimport java.util.List;", "A.java");

        assertThat(parsed.imports()).extracting(ImportRef::module).containsExactly("java.util.List");
    }

    // ---- Functions ----

    @Test
    void functions_pythonByIndentation() throws Exception {
        ParsedFile parsed = parser.parse(Samples.read("crypto_sample.py"), "crypto_sample.py");

        assertThat(parsed.functions()).extracting(FunctionInfo::name).containsExactly(
                "generate_signing_key", "legacy_checksum", "make_curve_key", "encrypt_legacy", "session_token");
        assertThat(parsed.functionAt(9)).map(FunctionInfo::name).contains("generate_signing_key");
        assertThat(parsed.functionAt(1)).isEmpty();
    }

    @Test
    void functions_javascriptByBraces() throws Exception {
        ParsedFile parsed = parser.parse(Samples.read("crypto_sample.js"), "crypto_sample.js");

        assertThat(parsed.functions()).extracting(FunctionInfo::name).containsExactly("createKeys", "label");
        assertThat(parsed.functionAt(7)).map(FunctionInfo::name).contains("createKeys");
    }

    @Test
    void functions_goAndJava() throws Exception {
        ParsedFile go = parser.parse(Samples.read("crypto_sample.go"), "crypto_sample.go");
        ParsedFile java = parser.parse(Samples.read("CryptoSample.java"), "CryptoSample.java");

        assertThat(go.functions()).extracting(FunctionInfo::name).containsExactly("generateKeys", "checksum");
        assertThat(java.functions()).extracting(FunctionInfo::name)
                .contains("rsaGenerator", "ecGenerator", "digest", "cipher", "context");
    }

    @Test
    void functions_rustSignatureWithLifetimes() throws Exception {
        String content = "pub fn sign_message<'a>(key: &'static str, msg: &'a [u8]) -> Vec<u8> {\n"
                + "    let k = RsaPrivateKey::new(&mut rng, 2048).expect(\"key generation failed\");\n"
                + "}\n";

        ParsedFile parsed = parser.parse(content, "sign.rs");

        assertThat(parsed.functions()).containsExactly(new FunctionInfo("sign_message", 1, 3));
        assertThat(parsed.lines().get(0).stringLiterals()).isEmpty();
        assertThat(parsed.lines().get(1).stringLiterals()).containsExactly(new TextSpan(54, 77));
    }

    @ParameterizedTest
    @ValueSource(strings = {"crypto_sample.py", "crypto_sample.js", "crypto_sample.go",
            "CryptoSample.java", "crypto_sample.rs", "false_positives.rs"})
    void functions_areOrderedAndNonOverlapping(String sample) throws Exception {
        ParsedFile parsed = parser.parse(Samples.read(sample), sample);

        List<FunctionInfo> functions = parsed.functions();
        for (int i = 0; i < functions.size(); i++) {
            FunctionInfo function = functions.get(i);
            assertThat(function.endLine()).isGreaterThanOrEqualTo(function.startLine());
            assertThat(function.endLine()).isLessThanOrEqualTo(parsed.lineCount());
            if (i > 0) {
                assertThat(function.startLine()).isGreaterThan(functions.get(i - 1).endLine());
            }
        }
    }

    @Test
    void functions_unbalancedBracesDoNotBreakLineNumbering() throws Exception {
        String content = "function broken() {\n  if (x) {\n    rsa();\n";

        ParsedFile parsed = parser.parse(content, "a.js");

        assertThat(parsed.lineCount()).isEqualTo(3);
        assertThat(parsed.functions()).hasSize(1);
        assertThat(parsed.functions().get(0).endLine()).isEqualTo(3);
    }
}
