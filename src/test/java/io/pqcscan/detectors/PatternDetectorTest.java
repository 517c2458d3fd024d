package io.pqcscan.detectors;

import io.pqcscan.ConfidenceWeights;
import io.pqcscan.Samples;
import io.pqcscan.model.PrimitiveFamily;
import io.pqcscan.model.Severity;
import io.pqcscan.parser.ParsedFile;
import io.pqcscan.parser.SourceParser;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class PatternDetectorTest {

    private static PatternDetector detector;
    private static SourceParser parser;

    @BeforeAll
    static void setUp() throws Exception {
        detector = PatternDetector.createDefault();
        parser = new SourceParser();
    }

    private static List<Detection> detectSample(String name) throws Exception {
        return detector.detect(parser.parse(Samples.read(name), name), name);
    }

    private static List<Detection> detect(String content, String path) throws Exception {
        return detector.detect(parser.parse(content, path), path);
    }

    @Test
    void detect_python() throws Exception {
        List<Detection> detections = detectSample("crypto_sample.py");

        assertThat(detections)
                .extracting(d -> d.location().line(), Detection::patternId)
                .containsExactly(
                        tuple(3, "rsa-usage"),
                        tuple(4, "des-cipher"),
                        tuple(9, "rsa-key-generation"),
                        tuple(9, "rsa-usage"),
                        tuple(14, "md5-hash"),
                        tuple(18, "ecdsa-key-generation"),
                        tuple(18, "ecdsa-usage"),
                        tuple(22, "des-cipher"),
                        tuple(22, "ecb-mode"),
                        tuple(27, "insecure-random"));
    }

    @Test
    void detect_pythonConfidenceReflectsContext() throws Exception {
        List<Detection> detections = detectSample("crypto_sample.py");

        // Module-level line, corroborated by the cryptography imports
        assertThat(find(detections, 3, "rsa-usage").confidence()).isCloseTo(0.65 * 1.25, within(1e-9));
        // Inside generate_signing_key, corroborated, call-shape clamps to 1
        assertThat(find(detections, 9, "rsa-key-generation").confidence()).isEqualTo(1.0);
        assertThat(find(detections, 9, "rsa-usage").confidence()).isCloseTo(0.65 * 1.2 * 1.25, within(1e-9));
        // legacy_checksum carries no crypto keyword
        assertThat(find(detections, 14, "md5-hash").confidence()).isCloseTo(0.65 * 1.25, within(1e-9));
    }

    @Test
    void detect_extractsKeySizeForPublicKeyFamilies() throws Exception {
        List<Detection> detections = detectSample("crypto_sample.py");

        assertThat(find(detections, 9, "rsa-key-generation").keySize()).isEqualTo(2048);
        assertThat(find(detections, 14, "md5-hash").keySize()).isNull();
    }

    @Test
    void detect_commentLinesProduceNothing() throws Exception {
        List<Detection> detections = detectSample("crypto_sample.py");

        assertThat(detections).noneMatch(d -> d.location().line() == 8);
    }

    @Test
    void detect_javascript() throws Exception {
        List<Detection> detections = detectSample("crypto_sample.js");

        assertThat(detections)
                .extracting(d -> d.location().line(), Detection::patternId)
                .containsExactly(
                        tuple(7, "rsa-key-generation"),
                        tuple(7, "rsa-usage"),
                        tuple(11, "sha1-hash"),
                        tuple(14, "rsa-usage"),
                        tuple(17, "insecure-random"));
        assertThat(find(detections, 14, "rsa-usage").confidence()).isCloseTo(0.65 * 1.25 * 0.4, within(1e-9));
        assertThat(find(detections, 7, "rsa-key-generation").keySize()).isEqualTo(2048);
    }

    @Test
    void detect_go() throws Exception {
        List<Detection> detections = detectSample("crypto_sample.go");

        assertThat(detections)
                .extracting(d -> d.location().line(), Detection::patternId)
                .containsExactly(
                        tuple(4, "ecdsa-usage"),
                        tuple(6, "md5-hash"),
                        tuple(8, "rsa-usage"),
                        tuple(14, "rsa-weak-key-size"),
                        tuple(14, "rsa-key-generation"),
                        tuple(14, "rsa-usage"),
                        tuple(15, "ecdsa-key-generation"),
                        tuple(15, "ecdsa-usage"),
                        tuple(20, "md5-hash"));
        assertThat(find(detections, 14, "rsa-weak-key-size").keySize()).isEqualTo(1024);
    }

    @Test
    void detect_java() throws Exception {
        List<Detection> detections = detectSample("CryptoSample.java");

        assertThat(detections)
                .extracting(d -> d.location().line(), Detection::patternId)
                .containsExactly(
                        tuple(11, "rsa-key-generation"),
                        tuple(11, "rsa-usage"),
                        tuple(17, "ecdsa-key-generation"),
                        tuple(17, "ec-algorithm-token"),
                        tuple(21, "sha1-hash"),
                        tuple(25, "triple-des"),
                        tuple(25, "ecb-mode"),
                        tuple(29, "legacy-tls-protocol"));
    }

    @Test
    void detect_rust() throws Exception {
        List<Detection> detections = detectSample("crypto_sample.rs");

        assertThat(detections)
                .extracting(d -> d.location().line(), Detection::patternId)
                .containsExactly(
                        tuple(1, "rsa-usage"),
                        tuple(2, "sha1-hash"),
                        tuple(3, "md5-hash"),
                        tuple(5, "rsa-usage"),
                        tuple(7, "rsa-key-generation"),
                        tuple(7, "rsa-usage"),
                        tuple(10, "md5-hash"),
                        tuple(11, "md5-hash"));
    }

    @Test
    void detect_prosePenalizedAndCommentsIgnored() throws Exception {
        List<Detection> detections = detectSample("false_positives.rs");

        assertThat(detections)
                .extracting(d -> d.location().line(), Detection::patternId)
                .containsExactly(tuple(6, "ecdsa-usage"), tuple(7, "md5-hash"));
        assertThat(detections).allSatisfy(d -> assertThat(d.confidence()).isCloseTo(0.26, within(1e-9)));
    }

    @Test
    void detect_locationsCarryPathColumnAndSnippet() throws Exception {
        List<Detection> detections = detect("x = 1\n    h = hashlib.md5(b)", "app/util.py");

        assertThat(detections).hasSize(1);
        Detection detection = detections.get(0);
        assertThat(detection.location().path()).isEqualTo("app/util.py");
        assertThat(detection.location().line()).isEqualTo(2);
        assertThat(detection.location().column()).isEqualTo(17);
        assertThat(detection.location().snippet()).isEqualTo("h = hashlib.md5(b)");
    }

    @Test
    void detect_onePerPatternAndLine() throws Exception {
        List<Detection> detections = detect("md5(md5(md5(x)))", "a.py");

        assertThat(detections).hasSize(1);
        assertThat(detections.get(0).location().column()).isEqualTo(1);
    }

    @Test
    void detect_importCorroboratedPatternNeedsImport() throws Exception {
        assertThat(detect("n = random.random()", "a.py")).isEmpty();
        assertThat(detect("import hmac\nn = random.random()", "a.py"))
                .extracting(Detection::patternId).containsExactly("insecure-random");
    }

    @Test
    void detect_languageRestrictedPatternSkipsOtherLanguages() throws Exception {
        String line = "import java.security.KeyFactory;\nKeyFactory.getInstance(\"EC\");";

        assertThat(detect(line, "A.java")).extracting(Detection::patternId).contains("ec-algorithm-token");
        assertThat(detect(line, "a.py")).extracting(Detection::patternId).doesNotContain("ec-algorithm-token");
    }

    @Test
    void detect_cleanContentProducesNothing() throws Exception {
        assertThat(detect("x = 42", "a.py")).isEmpty();
        assertThat(detect("", "a.py")).isEmpty();
        assertThat(detect("let traversal = describe(options);", "a.js")).isEmpty();
    }

    @Test
    void detect_unknownLanguageStillMatchesText() throws Exception {
        assertThat(detect("uses md5 for checksums", "README"))
                .extracting(Detection::patternId).containsExactly("md5-hash");
    }

    @Test
    void detect_isDeterministic() throws Exception {
        assertThat(detectSample("crypto_sample.go")).isEqualTo(detectSample("crypto_sample.go"));
    }

    @Test
    void detect_commentsScannedWhenStrippingDisabled() throws Exception {
        PatternDetector keepComments = PatternDetector.create(
                PatternCatalog.loadDefault().patterns(), ConfidenceWeights.defaults(), false, 4096);

        List<Detection> detections = keepComments.detect(parser.parse("# md5 here", "a.py"), "a.py");

        assertThat(detections).extracting(Detection::patternId).containsExactly("md5-hash");
    }

    @Test
    void detect_examinesOnlyMaxLineLengthCharacters() throws Exception {
        PatternDetector shortLines = PatternDetector.create(
                PatternCatalog.loadDefault().patterns(), ConfidenceWeights.defaults(), true, 10);
        String content = "x = 1234567 + md5(y)";

        assertThat(shortLines.detect(parser.parse(content, "a.py"), "a.py")).isEmpty();
        assertThat(detector.detect(parser.parse(content, "a.py"), "a.py")).hasSize(1);
    }

    @Test
    void create_rejectsDuplicateIdsAndUnsafeRegex() {
        CryptoPattern md5 = pattern("dup", "\\bmd5\\b");
        CryptoPattern greedy = pattern("greedy", "md5.*");

        assertThatThrownBy(() -> PatternDetector.create(List.of(md5, md5), ConfidenceWeights.defaults(), true, 100))
                .isInstanceOf(DetectionException.class)
                .hasMessageContaining("duplicate");
        assertThatThrownBy(() -> PatternDetector.create(List.of(greedy), ConfidenceWeights.defaults(), true, 100))
                .isInstanceOf(DetectionException.class)
                .hasMessageContaining("unbounded wildcard");
        assertThatThrownBy(() -> PatternDetector.create(List.of(md5), ConfidenceWeights.defaults(), true, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void detect_rustLifetimesDoNotChangeConfidence() throws Exception {
        String plain = "pub fn sign_message(key: &str) -> Vec<u8> {\n"
                + "    let k = RsaPrivateKey::new(&mut rng, 2048).expect(\"key generation failed\");\n"
                + "}\n";
        String withLifetime = plain.replace("&str", "&'static str");

        List<Detection> expected = detect(plain, "sign.rs");
        List<Detection> actual = detect(withLifetime, "sign.rs");

        assertThat(actual).extracting(Detection::patternId, Detection::confidence)
                .containsExactlyElementsOf(expected.stream()
                        .map(d -> tuple(d.patternId(), d.confidence()))
                        .toList());
        assertThat(find(actual, 2, "rsa-key-generation").confidence()).isCloseTo(0.90, within(1e-9));
    }

    @Test
    void detect_skipsLineWhereMatcherGivesUp() throws Exception {
        PatternDetector longLines = PatternDetector.create(
                List.of(pattern("slow", "\\w*x"), pattern("md5", "\\bmd5\\b")),
                ConfidenceWeights.defaults(), true, 20_000);
        String content = "a".repeat(20_000) + "\nh = md5(data)\nax = 1\n";

        List<Detection> detections = longLines.detect(parser.parse(content, "a.py"), "a.py");

        assertThat(detections)
                .extracting(d -> d.location().line(), Detection::patternId)
                .containsExactly(tuple(2, "md5"), tuple(3, "slow"));
    }

    @Test
    void pattern_looksUpById() {
        assertThat(detector.pattern("md5-hash")).get()
                .extracting(CryptoPattern::family).isEqualTo(PrimitiveFamily.BROKEN_HASH);
        assertThat(detector.pattern("nope")).isEmpty();
    }

    private static CryptoPattern pattern(String id, String regex) {
        return new CryptoPattern(id, null, PrimitiveFamily.BROKEN_HASH, Severity.HIGH, false,
                new MatcherSpec(MatcherKind.TEXT, List.of(regex), false), null, null, null, null);
    }

    private static Detection find(List<Detection> detections, int line, String patternId) {
        return detections.stream()
                .filter(d -> d.location().line() == line && d.patternId().equals(patternId))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No " + patternId + " on line " + line));
    }
}
