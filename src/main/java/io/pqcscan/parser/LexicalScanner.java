package io.pqcscan.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Single pass over source lines that separates comments from code and
 * records string literal spans. Block comments and multi-line strings carry
 * their state across lines; single-line strings are closed at end of line
 * so an unbalanced quote cannot swallow the rest of the file.
 */
class LexicalScanner {

    /**
     * Lexical result for one line.
     */
    record LexedLine(String code, boolean comment, List<TextSpan> literals) {
    }

    private enum State {
        CODE,
        BLOCK_COMMENT,
        STRING
    }

    private final LanguageSyntax syntax;

    private State state = State.CODE;
    private LanguageSyntax.Quote openQuote;

    LexicalScanner(LanguageSyntax syntax) {
        this.syntax = syntax;
    }

    List<LexedLine> scan(List<String> lines) {
        List<LexedLine> result = new ArrayList<>(lines.size());
        state = State.CODE;
        openQuote = null;
        for (String line : lines) {
            result.add(scanLine(line));
        }
        return result;
    }

    private LexedLine scanLine(String line) {
        int n = line.length();
        char[] code = line.toCharArray();
        List<TextSpan> literals = new ArrayList<>();

        boolean sawComment = state == State.BLOCK_COMMENT;
        boolean sawCode = false;
        int literalStart = 0;

        int i = 0;
        while (i < n) {
            switch (state) {
                case BLOCK_COMMENT -> {
                    sawComment = true;
                    String end = syntax.blockEnd();
                    if (line.startsWith(end, i)) {
                        mask(code, i, i + end.length());
                        i += end.length();
                        state = State.CODE;
                    } else {
                        code[i] = ' ';
                        i++;
                    }
                }
                case STRING -> {
                    sawCode = true;
                    char ch = line.charAt(i);
                    if (ch == '\\' && openQuote.escapes()) {
                        i += 2;
                    } else if (line.startsWith(openQuote.delimiter(), i)) {
                        i += openQuote.delimiter().length();
                        literals.add(new TextSpan(literalStart, i));
                        state = State.CODE;
                        openQuote = null;
                    } else {
                        i++;
                    }
                }
                case CODE -> {
                    String lineComment = lineCommentAt(line, i);
                    if (lineComment != null) {
                        sawComment = true;
                        mask(code, i, n);
                        i = n;
                        break;
                    }
                    if (syntax.hasBlockComments() && line.startsWith(syntax.blockStart(), i)) {
                        sawComment = true;
                        mask(code, i, i + syntax.blockStart().length());
                        i += syntax.blockStart().length();
                        state = State.BLOCK_COMMENT;
                        break;
                    }
                    LanguageSyntax.Quote quote = quoteAt(line, i);
                    if (quote != null && quote.charOnly()) {
                        sawCode = true;
                        int end = charLiteralEnd(line, i);
                        if (end < 0) {
                            i++;
                        } else {
                            literals.add(new TextSpan(i, end));
                            i = end;
                        }
                        break;
                    }
                    if (quote != null) {
                        sawCode = true;
                        literalStart = i;
                        openQuote = quote;
                        state = State.STRING;
                        i += quote.delimiter().length();
                        break;
                    }
                    if (!Character.isWhitespace(line.charAt(i))) {
                        sawCode = true;
                    }
                    i++;
                }
            }
        }

        if (state == State.STRING) {
            literals.add(new TextSpan(literalStart, n));
            if (!openQuote.multiLine()) {
                state = State.CODE;
                openQuote = null;
            }
        }

        return new LexedLine(new String(code), sawComment && !sawCode, literals);
    }

    private String lineCommentAt(String line, int offset) {
        for (String prefix : syntax.lineComments()) {
            if (line.startsWith(prefix, offset)) {
                return prefix;
            }
        }
        return null;
    }

    private LanguageSyntax.Quote quoteAt(String line, int offset) {
        for (LanguageSyntax.Quote quote : syntax.quotes()) {
            if (line.startsWith(quote.delimiter(), offset)) {
                return quote;
            }
        }
        return null;
    }

    /**
     * Returns the index after a character literal opening at {@code open}, or
     * -1 if the quote does not close after one character or one escape.
     */
    static int charLiteralEnd(String line, int open) {
        int n = line.length();
        int i = open + 1;
        if (i >= n) {
            return -1;
        }
        char ch = line.charAt(i);
        if (ch == '\'') {
            return -1;
        }
        if (ch == '\\') {
            if (i + 1 >= n) {
                return -1;
            }
            char escaped = line.charAt(i + 1);
            if (escaped == 'u' && i + 2 < n && line.charAt(i + 2) == '{') {
                int close = line.indexOf('}', i + 3);
                i = close < 0 ? n : close + 1;
            } else if (escaped == 'x') {
                i += 4;
            } else if (escaped == 'u') {
                i += 6;
            } else {
                i += 2;
            }
        } else if (Character.isHighSurrogate(ch)) {
            i += 2;
        } else {
            i += 1;
        }
        return i < n && line.charAt(i) == '\'' ? i + 1 : -1;
    }

    private static void mask(char[] chars, int from, int to) {
        int end = Math.min(to, chars.length);
        for (int i = from; i < end; i++) {
            chars[i] = ' ';
        }
    }
}
