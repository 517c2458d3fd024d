package io.pqcscan;

import io.pqcscan.detectors.MatcherKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Multiplier table used to score detections.
 * <p>
 * {@code confidence = base(kind) x boosts x penalty}, clamped to [0, 1].
 * Boosts must be at least 1 and the penalty must lie in (0, 1] so that
 * more corroborating context never lowers a score.
 *
 * @param textBase                 Base score of a bare textual match
 * @param callShapeBase            Base score of a call-shape match
 * @param importCorroboratedBase   Base score of an import-corroborated match
 * @param cryptoFunctionBoost      Applied when the enclosing function name suggests cryptography
 * @param corroboratingImportBoost Applied when the file imports a corroborating module
 * @param labelLiteralPenalty      Applied when the match sits inside a prose string literal
 * @param cryptoFunctionKeywords   Lower-case fragments that mark a function name as cryptographic
 */
public record ConfidenceWeights(
        double textBase,
        double callShapeBase,
        double importCorroboratedBase,
        double cryptoFunctionBoost,
        double corroboratingImportBoost,
        double labelLiteralPenalty,
        List<String> cryptoFunctionKeywords
) {
    public static final List<String> DEFAULT_CRYPTO_FUNCTION_KEYWORDS = List.of(
            "crypt", "cipher", "sign", "verify", "key", "hash", "digest", "hmac",
            "ecdsa", "ecdh", "dsa", "tls", "ssl", "cert", "secret", "nonce", "kdf");

    public ConfidenceWeights {
        cryptoFunctionKeywords = cryptoFunctionKeywords == null ? List.of()
                : cryptoFunctionKeywords.stream()
                        .filter(k -> k != null && !k.isBlank())
                        .map(k -> k.trim().toLowerCase(Locale.ROOT))
                        .toList();
    }

    public static ConfidenceWeights defaults() {
        return new ConfidenceWeights(0.65, 0.75, 0.8, 1.2, 1.25, 0.4, DEFAULT_CRYPTO_FUNCTION_KEYWORDS);
    }

    /**
     * Base score for a matcher kind.
     */
    public double base(MatcherKind kind) {
        return switch (kind) {
            case TEXT -> textBase;
            case CALL_SHAPE -> callShapeBase;
            case IMPORT_CORROBORATED -> importCorroboratedBase;
        };
    }

    /**
     * Returns every rule this table breaks; empty when valid.
     */
    public List<String> violations() {
        List<String> problems = new ArrayList<>();
        checkBase("textBase", textBase, problems);
        checkBase("callShapeBase", callShapeBase, problems);
        checkBase("importCorroboratedBase", importCorroboratedBase, problems);
        checkBoost("cryptoFunctionBoost", cryptoFunctionBoost, problems);
        checkBoost("corroboratingImportBoost", corroboratingImportBoost, problems);
        if (!(labelLiteralPenalty > 0.0 && labelLiteralPenalty <= 1.0)) {
            problems.add("labelLiteralPenalty must be in (0, 1], got " + labelLiteralPenalty);
        }
        return problems;
    }

    private static void checkBase(String name, double value, List<String> problems) {
        if (!(value > 0.0 && value <= 1.0)) {
            problems.add(name + " must be in (0, 1], got " + value);
        }
    }

    private static void checkBoost(String name, double value, List<String> problems) {
        if (!(value >= 1.0) || Double.isInfinite(value)) {
            problems.add(name + " must be a finite value >= 1, got " + value);
        }
    }
}
