package io.pqcscan.audit;

import io.pqcscan.parser.SourceDecoder;

/**
 * One in-memory input of a batch audit.
 *
 * @param content Source text
 * @param path    Path, or language hint, the content is reported under
 */
public record SourceFile(String content, String path) {

    public SourceFile {
        if (content == null) {
            content = "";
        }
    }

    public static SourceFile of(String content, String path) {
        return new SourceFile(content, path);
    }

    /**
     * Decodes raw bytes as UTF-8, replacing invalid sequences.
     */
    public static SourceFile fromBytes(byte[] content, String path) {
        return new SourceFile(SourceDecoder.decode(content).text(), path);
    }
}
