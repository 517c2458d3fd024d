package io.pqcscan.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Source languages understood by the parser.
 * {@link #UNKNOWN} degrades to plain line scanning.
 */
public enum Language {
    PYTHON("python", List.of("py", "pyw", "pyi"), List.of("python", "py")),
    JAVASCRIPT("javascript", List.of("js", "mjs", "cjs", "jsx"), List.of("javascript", "js", "node")),
    TYPESCRIPT("typescript", List.of("ts", "tsx", "mts", "cts"), List.of("typescript", "ts")),
    GO("go", List.of("go"), List.of("go", "golang")),
    JAVA("java", List.of("java"), List.of("java")),
    C_FAMILY("c-family", List.of("rs", "c", "h", "cc", "cpp", "cxx", "hpp", "hh", "hxx", "cs"),
            List.of("c-family", "rust", "rs", "c", "cpp", "c++", "cxx", "csharp", "cs", "c#")),
    UNKNOWN("unknown", List.of(), List.of("unknown"));

    private final String id;
    private final List<String> extensions;
    private final List<String> aliases;

    Language(String id, List<String> extensions, List<String> aliases) {
        this.id = id;
        this.extensions = extensions;
        this.aliases = aliases;
    }

    public String id() {
        return id;
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * Looks up a language by an explicit name such as "python" or "golang".
     */
    public static Optional<Language> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.aliases.contains(key)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up a language by the extension of a file path.
     */
    public static Optional<Language> fromPath(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        String fileName = path.replace('\\', '/');
        fileName = fileName.substring(fileName.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.extensions.contains(ext)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a path-or-language hint: explicit language name first,
     * then file extension, else {@link #UNKNOWN}.
     */
    public static Language resolve(String pathOrLanguage) {
        return fromName(pathOrLanguage)
                .or(() -> fromPath(pathOrLanguage))
                .orElse(UNKNOWN);
    }
}
