package io.pqcscan.detectors;

import io.pqcscan.model.Language;
import io.pqcscan.model.PrimitiveFamily;
import io.pqcscan.model.Severity;
import io.pqcscan.parser.ParsedFile;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A catalog entry describing one family of risky cryptographic usage.
 *
 * @param id                    Unique pattern id, e.g. "rsa-key-generation"
 * @param name                  Human-readable name
 * @param family                Primitive family the pattern targets
 * @param severity              Severity of every finding the pattern produces
 * @param quantumVulnerable     True if the targeted primitive falls to a quantum computer
 * @param matcher               How lines are matched
 * @param description           What a match means
 * @param recommendation        What to migrate to
 * @param corroboratingImports  Module-name fragments that confirm the primitive is really in use
 * @param languages             Languages the pattern applies to; empty means all
 */
public record CryptoPattern(
        String id,
        String name,
        PrimitiveFamily family,
        Severity severity,
        boolean quantumVulnerable,
        MatcherSpec matcher,
        String description,
        String recommendation,
        List<String> corroboratingImports,
        Set<Language> languages
) {
    public CryptoPattern {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (family == null) {
            throw new IllegalArgumentException("family cannot be null for pattern " + id);
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null for pattern " + id);
        }
        if (matcher == null) {
            throw new IllegalArgumentException("matcher cannot be null for pattern " + id);
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        description = description == null ? "" : description;
        recommendation = recommendation == null ? "" : recommendation;
        corroboratingImports = corroboratingImports == null ? List.of()
                : corroboratingImports.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
        languages = languages == null ? Set.of() : Set.copyOf(languages);
    }

    /**
     * Returns true if the pattern should be evaluated for the given language.
     */
    public boolean appliesTo(Language language) {
        return languages.isEmpty() || languages.contains(language);
    }

    /**
     * Returns true if the file imports any module containing one of the
     * corroborating fragments, compared case-insensitively.
     */
    public boolean corroboratedBy(ParsedFile file) {
        if (corroboratingImports.isEmpty()) {
            return false;
        }
        return file.hasImport(module -> {
            String lower = module.toLowerCase(Locale.ROOT);
            for (String fragment : corroboratingImports) {
                if (lower.contains(fragment)) {
                    return true;
                }
            }
            return false;
        });
    }
}
