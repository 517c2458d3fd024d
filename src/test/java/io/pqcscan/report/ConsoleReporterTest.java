package io.pqcscan.report;

import io.pqcscan.AuditConfig;
import io.pqcscan.Samples;
import io.pqcscan.audit.AuditEngine;
import io.pqcscan.audit.SourceFile;
import io.pqcscan.model.AuditReport;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReporterTest {

    private static AuditReport report;
    private static AuditReport clean;

    @BeforeAll
    static void setUp() throws Exception {
        AuditEngine engine = new AuditEngine(AuditConfig.defaults());
        report = engine.auditMany(List.of(
                SourceFile.of(Samples.read("crypto_sample.py"), "crypto_sample.py"),
                SourceFile.of("x", "../outside.py")), Instant.parse("2026-02-02T08:00:00Z"));
        clean = engine.auditOne("x = 42", "a.py");
    }

    @Test
    void write_summaryWithoutDetails() {
        String output = new ConsoleReporter(false).toString(report);

        assertThat(output)
                .contains("PQC-SCAN REPORT")
                .contains("Scan Date: 2026-02-02T08:00:00Z")
                .contains("Scanned: 1 files | 27 lines | 1 failed")
                .contains("Findings: 2 critical | 6 high | 1 medium | 1 low | 0 info")
                .contains("PRIMITIVE FAMILIES")
                .contains("RECOMMENDATIONS")
                .contains("FILES NOT ANALYZED")
                .contains("../outside.py [INVALID_INPUT]")
                .contains("ACTION REQUIRED")
                .contains("Run with --detailed")
                .doesNotContain("DETAILED FINDINGS")
                .doesNotContain("\u001B[");
    }

    @Test
    void write_detailedListsEveryFinding() {
        String output = new ConsoleReporter(false, true).toString(report);

        assertThat(output)
                .contains("DETAILED FINDINGS")
                .contains("[CRIT] CRITICAL FINDINGS (2)")
                .contains("Location: crypto_sample.py:9:11")
                .contains("Key Size: 2048 bits")
                .doesNotContain("Run with --detailed");
    }

    @Test
    void write_colorsWhenEnabled() {
        assertThat(new ConsoleReporter(true).toString(report)).contains("\u001B[");
    }

    @Test
    void write_cleanReport() {
        String output = new ConsoleReporter(false).toString(clean);

        assertThat(output)
                .contains("No critical issues found")
                .doesNotContain("PRIMITIVE FAMILIES")
                .doesNotContain("Scan Date");
        assertThat(new ConsoleReporter().format()).isEqualTo("console");
    }
}
