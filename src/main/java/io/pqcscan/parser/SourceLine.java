package io.pqcscan.parser;

import java.util.List;
import java.util.Optional;

/**
 * One line of a parsed file.
 *
 * @param number         1-based line number
 * @param text           Raw line text, without the line terminator
 * @param code           Same length as {@code text}, with comment characters replaced by spaces
 * @param comment        True if the line holds comment text and nothing else
 * @param indent         Indentation width (tabs count as 4)
 * @param stringLiterals Spans of string literals, quotes included
 */
public record SourceLine(
        int number,
        String text,
        String code,
        boolean comment,
        int indent,
        List<TextSpan> stringLiterals
) {
    public SourceLine {
        if (number < 1) {
            throw new IllegalArgumentException("line number must be >= 1, got " + number);
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (code == null) {
            code = text;
        }
        stringLiterals = stringLiterals == null ? List.of() : List.copyOf(stringLiterals);
    }

    /**
     * Returns true if the line is empty or whitespace only.
     */
    public boolean blank() {
        return text.isBlank();
    }

    /**
     * Returns the string literal containing the given offset, if any.
     */
    public Optional<TextSpan> literalAt(int offset) {
        for (TextSpan span : stringLiterals) {
            if (span.contains(offset)) {
                return Optional.of(span);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the code text with string literal contents blanked out,
     * leaving only structural characters such as braces.
     */
    public String structure() {
        if (stringLiterals.isEmpty()) {
            return code;
        }
        char[] chars = code.toCharArray();
        for (TextSpan span : stringLiterals) {
            int end = Math.min(span.end(), chars.length);
            for (int i = span.start(); i < end; i++) {
                chars[i] = ' ';
            }
        }
        return new String(chars);
    }
}
