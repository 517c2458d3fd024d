package io.pqcscan.audit;

import io.pqcscan.detectors.CryptoPattern;
import io.pqcscan.detectors.Detection;
import io.pqcscan.model.Finding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Converts detections into findings with stable ids.
 */
class FindingFactory {

    private static final String ID_PREFIX = "PQC-";

    Finding create(Detection detection, CryptoPattern pattern) {
        return Finding.builder()
                .id(findingId(pattern.id(), detection.location().path(),
                        detection.location().line(), detection.location().column()))
                .patternId(pattern.id())
                .patternName(pattern.name())
                .severity(pattern.severity())
                .primitiveFamily(pattern.family())
                .location(detection.location())
                .description(pattern.description())
                .recommendation(pattern.recommendation())
                .confidence(detection.confidence())
                .quantumVulnerable(pattern.quantumVulnerable())
                .keySize(detection.keySize())
                .build();
    }

    /**
     * Derives the id from pattern and location only, so rescanning the same
     * input yields the same ids.
     */
    static String findingId(String patternId, String path, int line, int column) {
        String key = patternId + "|" + path + "|" + line + "|" + column;
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            return ID_PREFIX + HexFormat.of().formatHex(digest, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
