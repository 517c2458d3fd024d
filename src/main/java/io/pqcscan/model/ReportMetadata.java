package io.pqcscan.model;

import java.time.Instant;
import java.util.List;

/**
 * Metadata attached to an audit report.
 *
 * @param toolVersion Version of the engine that produced the report
 * @param timestamp   Caller-supplied scan time, or null when none was given
 * @param fileErrors  Files that could not be analyzed
 */
public record ReportMetadata(
        String toolVersion,
        Instant timestamp,
        List<FileError> fileErrors
) {
    public ReportMetadata {
        fileErrors = fileErrors == null ? List.of() : List.copyOf(fileErrors);
    }
}
