package io.pqcscan.parser;

import io.pqcscan.model.Language;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Line-indexed, comment-aware view of one source file.
 * Immutable; line numbers are contiguous and start at 1.
 *
 * @param language  Resolved language
 * @param lines     One entry per input line
 * @param imports   Imports in file order
 * @param functions Function boundaries in file order, non-overlapping
 * @param degraded  True if the text was decoded lossily or the language is unknown
 */
public record ParsedFile(
        Language language,
        List<SourceLine> lines,
        List<ImportRef> imports,
        List<FunctionInfo> functions,
        boolean degraded
) {
    public ParsedFile {
        if (language == null) {
            throw new IllegalArgumentException("language cannot be null");
        }
        lines = lines == null ? List.of() : List.copyOf(lines);
        imports = imports == null ? List.of() : List.copyOf(imports);
        functions = functions == null ? List.of() : List.copyOf(functions);
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).number() != i + 1) {
                throw new IllegalArgumentException("Line numbers must be contiguous from 1; found "
                        + lines.get(i).number() + " at index " + i);
            }
        }
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * Returns the 1-based line, if present.
     */
    public Optional<SourceLine> line(int number) {
        if (number < 1 || number > lines.size()) {
            return Optional.empty();
        }
        return Optional.of(lines.get(number - 1));
    }

    /**
     * Returns the function whose body contains the given line, if any.
     */
    public Optional<FunctionInfo> functionAt(int line) {
        for (FunctionInfo function : functions) {
            if (function.contains(line)) {
                return Optional.of(function);
            }
            if (function.startLine() > line) {
                break;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns true if any import's module satisfies the predicate.
     */
    public boolean hasImport(Predicate<String> modulePredicate) {
        return imports.stream().map(ImportRef::module).anyMatch(modulePredicate);
    }
}
