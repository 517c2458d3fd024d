package io.pqcscan.parser;

import io.pqcscan.model.Language;

import java.util.List;

/**
 * Comment and string-literal syntax of a language.
 *
 * @param lineComments  Prefixes that start a comment running to end of line
 * @param blockStart    Block comment opener, or null
 * @param blockEnd      Block comment closer, or null
 * @param quotes        String delimiters, longest first
 * @param braceBodies   True if function bodies are delimited by braces
 */
public record LanguageSyntax(
        List<String> lineComments,
        String blockStart,
        String blockEnd,
        List<Quote> quotes,
        boolean braceBodies
) {
    /**
     * A string delimiter.
     *
     * @param delimiter Opening and closing text
     * @param multiLine True if the literal may span lines
     * @param escapes   True if backslash escapes the next character
     * @param charOnly  True if the delimiter only opens a literal of one
     *                  character or one escape; otherwise it is code, as in
     *                  Rust lifetimes ({@code &'static str}, {@code <'a>})
     */
    public record Quote(String delimiter, boolean multiLine, boolean escapes, boolean charOnly) {

        public Quote(String delimiter, boolean multiLine, boolean escapes) {
            this(delimiter, multiLine, escapes, false);
        }
    }

    private static final Quote DOUBLE = new Quote("\"", false, true);
    private static final Quote SINGLE = new Quote("'", false, true);
    private static final Quote CHAR = new Quote("'", false, true, true);

    private static final LanguageSyntax PYTHON = new LanguageSyntax(
            List.of("#"), null, null,
            List.of(new Quote("\"\"\"", true, true), new Quote("'''", true, true), DOUBLE, SINGLE),
            false);

    private static final LanguageSyntax JAVASCRIPT = new LanguageSyntax(
            List.of("//"), "/*", "*/",
            List.of(new Quote("`", true, true), DOUBLE, SINGLE),
            true);

    private static final LanguageSyntax GO = new LanguageSyntax(
            List.of("//"), "/*", "*/",
            List.of(new Quote("`", true, false), DOUBLE, SINGLE),
            true);

    private static final LanguageSyntax JAVA = new LanguageSyntax(
            List.of("//"), "/*", "*/",
            List.of(new Quote("\"\"\"", true, true), DOUBLE, SINGLE),
            true);

    private static final LanguageSyntax C_FAMILY = new LanguageSyntax(
            List.of("//"), "/*", "*/",
            List.of(DOUBLE, CHAR),
            true);

    private static final LanguageSyntax PLAIN = new LanguageSyntax(
            List.of(), null, null, List.of(), false);

    public LanguageSyntax {
        lineComments = lineComments == null ? List.of() : List.copyOf(lineComments);
        quotes = quotes == null ? List.of() : List.copyOf(quotes);
        if ((blockStart == null) != (blockEnd == null)) {
            throw new IllegalArgumentException("blockStart and blockEnd must both be set or both be null");
        }
    }

    public static LanguageSyntax forLanguage(Language language) {
        return switch (language) {
            case PYTHON -> PYTHON;
            case JAVASCRIPT, TYPESCRIPT -> JAVASCRIPT;
            case GO -> GO;
            case JAVA -> JAVA;
            case C_FAMILY -> C_FAMILY;
            case UNKNOWN -> PLAIN;
        };
    }

    public boolean hasBlockComments() {
        return blockStart != null;
    }
}
