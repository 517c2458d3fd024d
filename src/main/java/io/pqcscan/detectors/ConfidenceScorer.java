package io.pqcscan.detectors;

import io.pqcscan.ConfidenceWeights;
import io.pqcscan.parser.FunctionInfo;
import io.pqcscan.parser.ParsedFile;
import io.pqcscan.parser.SourceLine;
import io.pqcscan.parser.TextSpan;

import java.util.Locale;
import java.util.Optional;

/**
 * Turns a raw match plus its surrounding context into a confidence value.
 */
public class ConfidenceScorer {

    private final ConfidenceWeights weights;

    public ConfidenceScorer(ConfidenceWeights weights) {
        this.weights = weights;
    }

    /**
     * Scores one match.
     *
     * @param kind         Matcher kind of the pattern
     * @param file         File being scanned
     * @param line         Line holding the match
     * @param offset       0-based offset of the match start in the line
     * @param corroborated True if the file imports a module corroborating the pattern
     * @return Confidence in [0.0, 1.0]
     */
    public double score(MatcherKind kind, ParsedFile file, SourceLine line, int offset, boolean corroborated) {
        double confidence = weights.base(kind);
        if (inCryptoFunction(file, line.number())) {
            confidence *= weights.cryptoFunctionBoost();
        }
        if (corroborated) {
            confidence *= weights.corroboratingImportBoost();
        }
        if (inLabelLiteral(line, offset)) {
            confidence *= weights.labelLiteralPenalty();
        }
        return clamp(confidence);
    }

    boolean inCryptoFunction(ParsedFile file, int lineNumber) {
        Optional<FunctionInfo> function = file.functionAt(lineNumber);
        if (function.isEmpty()) {
            return false;
        }
        String name = function.get().name().toLowerCase(Locale.ROOT);
        for (String keyword : weights.cryptoFunctionKeywords()) {
            if (name.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A literal counts as a label when its contents contain whitespace,
     * e.g. {@code "RSA key rotation"}; algorithm identifiers such as
     * {@code "RSA/ECB/PKCS1Padding"} do not.
     */
    static boolean inLabelLiteral(SourceLine line, int offset) {
        Optional<TextSpan> literal = line.literalAt(offset);
        if (literal.isEmpty()) {
            return false;
        }
        TextSpan span = literal.get();
        int end = Math.min(span.end(), line.text().length());
        for (int i = span.start(); i < end; i++) {
            if (Character.isWhitespace(line.text().charAt(i))) {
                return true;
            }
        }
        return false;
    }

    static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
