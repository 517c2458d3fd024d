package io.pqcscan.audit;

import io.pqcscan.model.AuditSummary;
import io.pqcscan.model.Finding;
import io.pqcscan.model.PrimitiveFamily;
import io.pqcscan.model.RiskScore;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the summary block of a report, including migration advice for
 * the primitive families that were found.
 */
class SummaryBuilder {

    AuditSummary build(List<Finding> findings, RiskScore risk, int filesScanned, int filesFailed, long lines) {
        Set<PrimitiveFamily> present = EnumSet.noneOf(PrimitiveFamily.class);
        Set<PrimitiveFamily> quantumVulnerable = EnumSet.noneOf(PrimitiveFamily.class);
        for (Finding finding : findings) {
            present.add(finding.primitiveFamily());
            if (finding.quantumVulnerable()) {
                quantumVulnerable.add(finding.primitiveFamily());
            }
        }
        List<PrimitiveFamily> deprecated = present.stream().filter(PrimitiveFamily::deprecated).toList();

        return new AuditSummary(filesScanned, filesFailed, lines,
                List.copyOf(quantumVulnerable), deprecated, recommendations(present, risk));
    }

    static List<String> recommendations(Set<PrimitiveFamily> present, RiskScore risk) {
        List<String> advice = new ArrayList<>();
        if (risk.critical() > 0) {
            advice.add("CRITICAL: migrate now to quantum-safe algorithms (ML-KEM / CRYSTALS-Kyber, ML-DSA / CRYSTALS-Dilithium)");
        }
        if (risk.high() > 0) {
            advice.add("HIGH PRIORITY: plan the migration to post-quantum cryptography within 6-12 months");
        }
        for (PrimitiveFamily family : present) {
            String text = switch (family) {
                case INTEGER_FACTORIZATION ->
                        "Replace RSA with ML-DSA (Dilithium) for signatures or ML-KEM (Kyber) for encryption";
                case ELLIPTIC_CURVE ->
                        "Replace ECDSA/EdDSA with ML-DSA (Dilithium) or SLH-DSA (SPHINCS+)";
                case DISCRETE_LOG -> "Replace DSA with ML-DSA (Dilithium)";
                case KEY_EXCHANGE ->
                        "Replace Diffie-Hellman/ECDH with ML-KEM (Kyber), ideally in hybrid mode during transition";
                case BROKEN_HASH -> "Replace MD5/SHA-1 with SHA-256 or SHA-3";
                case DEPRECATED_CIPHER -> "Replace DES/3DES/RC4/Blowfish and ECB mode with AES-256-GCM or ChaCha20-Poly1305";
                case DEPRECATED_PROTOCOL -> "Disable SSL and TLS 1.0/1.1; require TLS 1.3 or at least 1.2";
                case WEAK_RANDOM -> "Use a cryptographically secure random generator for key material and tokens";
            };
            advice.add(text);
        }
        return advice;
    }
}
