package io.pqcscan.detectors;

import io.pqcscan.model.Language;
import io.pqcscan.model.PrimitiveFamily;
import io.pqcscan.model.Severity;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, id-unique collection of {@link CryptoPattern}s loaded from YAML.
 * <p>
 * The default catalog ships as the classpath resource {@code /crypto-patterns.yaml}.
 * Additional catalogs can be merged on top of it; an entry with an existing id
 * replaces the earlier definition.
 */
public class PatternCatalog {

    private static final String DEFAULT_CATALOG = "/crypto-patterns.yaml";

    private final Map<String, CryptoPattern> patterns;

    private PatternCatalog(Map<String, CryptoPattern> patterns) {
        this.patterns = patterns;
    }

    /**
     * Creates a catalog from explicit patterns.
     *
     * @throws IllegalArgumentException if two patterns share an id
     */
    public static PatternCatalog of(List<CryptoPattern> patterns) {
        Map<String, CryptoPattern> byId = new LinkedHashMap<>();
        for (CryptoPattern pattern : patterns) {
            if (byId.putIfAbsent(pattern.id(), pattern) != null) {
                throw new IllegalArgumentException("Duplicate pattern id: " + pattern.id());
            }
        }
        return new PatternCatalog(byId);
    }

    /**
     * Loads the catalog bundled with the library.
     */
    public static PatternCatalog loadDefault() {
        try (InputStream is = PatternCatalog.class.getResourceAsStream(DEFAULT_CATALOG)) {
            if (is == null) {
                throw new IllegalStateException("Default pattern catalog not found: " + DEFAULT_CATALOG);
            }
            return load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load default pattern catalog", e);
        }
    }

    /**
     * Loads a catalog from a YAML file.
     */
    public static PatternCatalog loadFromFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        }
    }

    /**
     * Loads a catalog from a YAML stream with a top-level {@code patterns} list.
     *
     * @throws IllegalArgumentException if an entry is malformed or an id repeats
     */
    public static PatternCatalog load(InputStream is) {
        Yaml yaml = new Yaml();
        Object root = yaml.load(is);
        if (root == null) {
            return of(List.of());
        }
        if (!(root instanceof Map<?, ?> document)) {
            throw new IllegalArgumentException("Pattern catalog must be a mapping with a 'patterns' list");
        }
        Object entries = document.get("patterns");
        if (entries == null) {
            return of(List.of());
        }
        if (!(entries instanceof List<?> list)) {
            throw new IllegalArgumentException("'patterns' must be a list");
        }
        List<CryptoPattern> parsed = new ArrayList<>(list.size());
        for (Object entry : list) {
            if (!(entry instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("Pattern entry must be a mapping: " + entry);
            }
            parsed.add(toPattern(map));
        }
        return of(parsed);
    }

    private static CryptoPattern toPattern(Map<?, ?> entry) {
        String id = getString(entry, "id");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Pattern entry without id: " + entry);
        }
        try {
            PrimitiveFamily family = PrimitiveFamily.parse(getString(entry, "family"));
            Severity severity = Severity.parse(getString(entry, "severity"));
            Object qv = entry.get("quantumVulnerable");
            boolean quantumVulnerable = qv instanceof Boolean b ? b : family.quantumVulnerable();

            return new CryptoPattern(
                    id.trim(),
                    getString(entry, "name"),
                    family,
                    severity,
                    quantumVulnerable,
                    toMatcher(entry.get("matcher")),
                    getString(entry, "description"),
                    getString(entry, "recommendation"),
                    getStringList(entry, "corroboratingImports"),
                    toLanguages(getStringList(entry, "languages")));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid pattern '" + id + "': " + e.getMessage(), e);
        }
    }

    private static MatcherSpec toMatcher(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("matcher must be a mapping");
        }
        List<String> regexes = new ArrayList<>(getStringList(map, "regex"));
        if (regexes.isEmpty() && map.get("regex") instanceof String single) {
            regexes.add(single);
        }
        Object ci = map.get("caseInsensitive");
        return new MatcherSpec(MatcherKind.parse(getString(map, "kind")), regexes, Boolean.TRUE.equals(ci));
    }

    private static Set<Language> toLanguages(List<String> names) {
        Set<Language> languages = new LinkedHashSet<>();
        for (String name : names) {
            languages.add(Language.fromName(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown language: " + name)));
        }
        return languages;
    }

    private static String getString(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : null;
    }

    private static List<String> getStringList(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>();
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        return List.of();
    }

    /**
     * Merges this catalog with another, the other taking precedence on equal ids.
     */
    public PatternCatalog merge(PatternCatalog other) {
        Map<String, CryptoPattern> merged = new LinkedHashMap<>(this.patterns);
        merged.putAll(other.patterns);
        return new PatternCatalog(merged);
    }

    public List<CryptoPattern> patterns() {
        return List.copyOf(patterns.values());
    }

    public Optional<CryptoPattern> getById(String id) {
        return Optional.ofNullable(patterns.get(id));
    }

    public Set<String> ids() {
        return Set.copyOf(patterns.keySet());
    }

    public boolean contains(String id) {
        return patterns.containsKey(id);
    }

    public int size() {
        return patterns.size();
    }
}
