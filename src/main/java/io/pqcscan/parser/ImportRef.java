package io.pqcscan.parser;

/**
 * A module or package referenced by an import statement, recorded verbatim.
 *
 * @param module Referenced name, e.g. "cryptography.hazmat.primitives" or "crypto/rsa"
 * @param line   1-based line of the import
 */
public record ImportRef(String module, int line) {

    public ImportRef {
        if (module == null || module.isBlank()) {
            throw new IllegalArgumentException("module cannot be null or blank");
        }
    }
}
