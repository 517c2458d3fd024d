package io.pqcscan.detectors;

import java.util.List;

/**
 * Uncompiled matcher of a catalog pattern.
 *
 * @param kind            Matcher variant, which also selects the base confidence
 * @param regexes         Alternative expressions; the earliest match on a line wins
 * @param caseInsensitive Compile every expression with {@code CASE_INSENSITIVE}
 */
public record MatcherSpec(
        MatcherKind kind,
        List<String> regexes,
        boolean caseInsensitive
) {
    public MatcherSpec {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        regexes = regexes == null ? List.of() : List.copyOf(regexes);
    }
}
