package io.pqcscan.report;

import io.pqcscan.model.AuditReport;
import io.pqcscan.model.FileError;
import io.pqcscan.model.Finding;
import io.pqcscan.model.PrimitiveFamily;
import io.pqcscan.model.RiskLevel;
import io.pqcscan.model.RiskScore;
import io.pqcscan.model.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Formats audit results for console output with ANSI colors.
 * <p>
 * By default prints a summary, a breakdown by primitive family and the
 * migration advice. The detailed mode adds one block per finding.
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private final boolean useColors;
    private final boolean detailed;

    public ConsoleReporter() {
        this(true, false);
    }

    public ConsoleReporter(boolean useColors) {
        this(useColors, false);
    }

    public ConsoleReporter(boolean useColors, boolean detailed) {
        this.useColors = useColors;
        this.detailed = detailed;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(AuditReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, report);
        printSummary(out, report);
        printFamilyBreakdown(out, report);
        printRecommendations(out, report);
        printFileErrors(out, report.metadata().fileErrors());

        if (detailed) {
            printDetailedFindings(out, report);
        }

        printFooter(out, report);
        out.flush();
    }

    private void printHeader(PrintWriter out, AuditReport report) {
        out.println();
        out.println(line('=', 70));
        out.println(center("PQC-SCAN REPORT", 70));
        out.println(line('=', 70));
        out.println();

        out.println("Tool Version: " + report.metadata().toolVersion());
        if (report.metadata().timestamp() != null) {
            out.println("Scan Date: " + report.metadata().timestamp());
        }
        out.println();
    }

    private void printSummary(PrintWriter out, AuditReport report) {
        RiskScore risk = report.riskScore();
        out.println(bold("SUMMARY"));
        out.println(line('-', 70));

        out.println(String.format(Locale.ROOT, "Scanned: %,d files | %,d lines | %d failed",
                report.summary().filesScanned(),
                report.summary().linesScanned(),
                report.summary().filesFailed()));

        StringBuilder findings = new StringBuilder("Findings: ");
        if (risk.critical() > 0) {
            findings.append(color(RED, risk.critical() + " critical")).append(" | ");
        } else {
            findings.append("0 critical | ");
        }
        if (risk.high() > 0) {
            findings.append(color(YELLOW, risk.high() + " high")).append(" | ");
        } else {
            findings.append("0 high | ");
        }
        findings.append(risk.medium()).append(" medium | ")
                .append(risk.low()).append(" low | ")
                .append(risk.info()).append(" info");
        out.println(findings);

        out.println(String.format(Locale.ROOT, "Risk Score: %.2f (%s)",
                risk.total(), riskIndicator(risk.riskLevel())));

        if (!report.summary().quantumVulnerableFamilies().isEmpty()) {
            out.println("Quantum-vulnerable: " + displayNames(report.summary().quantumVulnerableFamilies()));
        }
        if (!report.summary().deprecatedFamilies().isEmpty()) {
            out.println("Deprecated: " + displayNames(report.summary().deprecatedFamilies()));
        }
        out.println();
    }

    private void printFamilyBreakdown(PrintWriter out, AuditReport report) {
        Map<PrimitiveFamily, List<Finding>> byFamily = report.findingsByFamily();
        if (byFamily.isEmpty()) {
            return;
        }

        out.println(bold("PRIMITIVE FAMILIES"));
        out.println(line('-', 40));
        for (PrimitiveFamily family : PrimitiveFamily.values()) {
            List<Finding> findings = byFamily.get(family);
            if (findings == null) {
                continue;
            }
            long files = findings.stream().map(Finding::path).distinct().count();
            out.printf("  %s: %d findings (%d files)%n", family.displayName(), findings.size(), files);
        }
        out.println();
    }

    private void printRecommendations(PrintWriter out, AuditReport report) {
        List<String> recommendations = report.summary().recommendations();
        if (recommendations.isEmpty()) {
            return;
        }
        out.println(bold("RECOMMENDATIONS"));
        out.println(line('-', 40));
        for (String recommendation : recommendations) {
            out.println("  - " + recommendation);
        }
        out.println();
    }

    private void printFileErrors(PrintWriter out, List<FileError> errors) {
        if (errors.isEmpty()) {
            return;
        }
        out.println(bold("FILES NOT ANALYZED") + color(CYAN, " (" + errors.size() + ")"));
        out.println(line('-', 40));
        for (FileError error : errors) {
            out.println("  " + error.path() + " [" + error.kind() + "] " + error.message());
        }
        out.println();
    }

    private void printDetailedFindings(PrintWriter out, AuditReport report) {
        out.println();
        out.println(bold("DETAILED FINDINGS"));
        out.println(line('=', 70));

        Map<Severity, List<Finding>> bySeverity = report.findingsBySeverity();
        for (Severity severity : Severity.values()) {
            List<Finding> findings = bySeverity.getOrDefault(severity, List.of());
            if (!findings.isEmpty()) {
                printFindingGroup(out, severity, findings);
            }
        }
    }

    private void printFindingGroup(PrintWriter out, Severity severity, List<Finding> findings) {
        out.println(bold(severityIndicator(severity) + " " + severity.label() + " FINDINGS (" + findings.size() + ")"));
        out.println(line('-', 70));

        int index = 1;
        for (Finding finding : findings) {
            printFinding(out, index++, finding);
        }
        out.println();
    }

    private void printFinding(PrintWriter out, int index, Finding finding) {
        out.println("[" + index + "] " + bold(finding.patternName()) + " (" + finding.id() + ")");
        out.println("    Location: " + finding.location().display());
        if (!finding.location().snippet().isEmpty()) {
            out.println("    Code: " + finding.location().snippet());
        }
        out.println("    Family: " + finding.primitiveFamily().displayName()
                + (finding.quantumVulnerable() ? color(RED, " [quantum-vulnerable]") : ""));
        out.println(String.format(Locale.ROOT, "    Confidence: %.2f", finding.confidence()));
        if (finding.keySize() != null) {
            out.println("    Key Size: " + finding.keySize() + " bits");
        }
        if (!finding.description().isEmpty()) {
            out.println("    Description: " + finding.description());
        }
        if (!finding.recommendation().isEmpty()) {
            out.println("    " + color(GREEN, "Recommendation: " + finding.recommendation()));
        }
        out.println();
    }

    private void printFooter(PrintWriter out, AuditReport report) {
        out.println(line('=', 70));

        int critical = report.riskScore().critical();
        int high = report.riskScore().high();

        if (critical > 0) {
            out.println(color(RED, bold("ACTION REQUIRED: " + critical +
                    " critical finding(s) need a post-quantum migration plan now.")));
        } else if (high > 0) {
            out.println(color(YELLOW, "ATTENTION: " + high +
                    " high-risk finding(s) should be scheduled for migration."));
        } else {
            out.println(color(GREEN, "No critical issues found. Review medium/low findings as needed."));
        }

        if (!detailed && report.totalFindings() > 0) {
            out.println();
            out.println("Run with --detailed for complete finding details.");
        }

        out.println();
    }

    private String severityIndicator(Severity severity) {
        return switch (severity) {
            case CRITICAL -> color(RED, "[CRIT]");
            case HIGH -> color(YELLOW, "[HIGH]");
            case MEDIUM -> "[MED]";
            case LOW -> "[LOW]";
            case INFO -> color(CYAN, "[INFO]");
        };
    }

    private String riskIndicator(RiskLevel level) {
        return switch (level) {
            case CATASTROPHIC -> color(RED, bold(level.label()));
            case HIGH -> color(RED, level.label());
            case MEDIUM -> color(YELLOW, level.label());
            case LOW -> color(GREEN, level.label());
        };
    }

    private static String displayNames(List<PrimitiveFamily> families) {
        return families.stream().map(PrimitiveFamily::displayName).collect(Collectors.joining(", "));
    }

    // Formatting helpers

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
