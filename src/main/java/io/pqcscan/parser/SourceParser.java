package io.pqcscan.parser;

import io.pqcscan.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts raw source text into a {@link ParsedFile}.
 * <p>
 * Stateless and thread-safe: every call works on its own data. The only hard
 * failure is content larger than the configured limit; undecodable bytes,
 * unknown languages and confusing syntax all degrade into a best-effort result.
 */
public class SourceParser {

    private static final Logger log = LoggerFactory.getLogger(SourceParser.class);

    public static final long DEFAULT_MAX_INPUT_SIZE = 10L * 1024 * 1024;

    private final long maxInputSize;

    public SourceParser() {
        this(DEFAULT_MAX_INPUT_SIZE);
    }

    /**
     * @param maxInputSize Maximum accepted content size in UTF-8 bytes
     */
    public SourceParser(long maxInputSize) {
        if (maxInputSize <= 0) {
            throw new IllegalArgumentException("maxInputSize must be positive, got " + maxInputSize);
        }
        this.maxInputSize = maxInputSize;
    }

    /**
     * Parses text submitted under a path or an explicit language name.
     *
     * @param content        Source text
     * @param pathOrLanguage File path (language taken from extension) or a language name
     * @return Parsed representation; never null
     * @throws SourceParseException if the content exceeds the size limit
     */
    public ParsedFile parse(String content, String pathOrLanguage) throws SourceParseException {
        return parse(content, Language.resolve(pathOrLanguage));
    }

    /**
     * Parses raw bytes, decoding them as UTF-8 with replacement of invalid sequences.
     */
    public ParsedFile parse(byte[] content, String pathOrLanguage) throws SourceParseException {
        byte[] bytes = content != null ? content : new byte[0];
        if (bytes.length > maxInputSize) {
            throw SourceParseException.inputTooLarge(bytes.length, maxInputSize);
        }
        SourceDecoder.Decoded decoded = SourceDecoder.decode(bytes);
        return build(decoded.text(), Language.resolve(pathOrLanguage), decoded.lossy());
    }

    /**
     * Parses text in an explicitly chosen language.
     */
    public ParsedFile parse(String content, Language language) throws SourceParseException {
        String text = content != null ? content : "";
        long size = SourceDecoder.utf8Length(text);
        if (size > maxInputSize) {
            throw SourceParseException.inputTooLarge(size, maxInputSize);
        }
        return build(text, language != null ? language : Language.UNKNOWN, text.indexOf('\uFFFD') >= 0);
    }

    private ParsedFile build(String text, Language language, boolean lossy) {
        List<String> rawLines = splitLines(text);

        LexicalScanner scanner = new LexicalScanner(LanguageSyntax.forLanguage(language));
        List<LexicalScanner.LexedLine> lexed = scanner.scan(rawLines);

        List<SourceLine> lines = new ArrayList<>(rawLines.size());
        for (int i = 0; i < rawLines.size(); i++) {
            String raw = rawLines.get(i);
            LexicalScanner.LexedLine lex = lexed.get(i);
            lines.add(new SourceLine(i + 1, raw, lex.code(), lex.comment(), indentOf(raw), lex.literals()));
        }

        List<ImportRef> imports = new ImportExtractor(language).extract(lines);
        List<FunctionInfo> functions = new FunctionBoundaryDetector(language).detect(lines);

        boolean degraded = lossy || language == Language.UNKNOWN;
        if (degraded) {
            log.debug("Degraded parse: language={}, lossyDecoding={}, lines={}", language.id(), lossy, lines.size());
        }
        return new ParsedFile(language, lines, imports, functions, degraded);
    }

    /**
     * Splits on \n, \r\n and \r. A trailing terminator does not start a new line,
     * and empty content has no lines.
     */
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int n = text.length();
        for (int i = 0; i < n; i++) {
            char ch = text.charAt(i);
            if (ch == '\n' || ch == '\r') {
                lines.add(text.substring(start, i));
                if (ch == '\r' && i + 1 < n && text.charAt(i + 1) == '\n') {
                    i++;
                }
                start = i + 1;
            }
        }
        if (start < n) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    private static int indentOf(String line) {
        int indent = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ' ') {
                indent++;
            } else if (ch == '\t') {
                indent += 4;
            } else {
                break;
            }
        }
        return indent;
    }
}
