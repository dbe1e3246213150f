package com.buildcheck.core.report;

import com.buildcheck.core.model.CompatibilityResult;
import com.buildcheck.core.model.ComponentType;
import com.buildcheck.core.model.PowerAnalysis;
import com.buildcheck.core.model.ValidationIssue;
import com.buildcheck.core.model.ValidationResult;
import com.buildcheck.core.power.PsuRecommendation;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Plain-text reports of engine results for terminal output, with optional ANSI colors.
 *
 * <p>Color support can be disabled for CI environments or when redirecting output.
 */
public class ConsoleReport {

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private final boolean useColors;

    /**
     * Creates a report writer.
     *
     * @param useColors whether to wrap headings and statuses in ANSI colors
     */
    public ConsoleReport(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Renders a validation result.
     *
     * @param result validation result
     * @return report text
     */
    public String validation(ValidationResult result) {
        StringBuilder out = new StringBuilder();

        if (result.valid()) {
            out.append(color(ANSI_BOLD + ANSI_GREEN, "Build is compatible")).append('\n');
        } else {
            out.append(color(ANSI_BOLD + ANSI_RED, "Build has " + result.errors().size() + " error(s)")).append('\n');
        }

        if (!result.complete()) {
            String missing = result.missingComponents().stream()
                .map(ComponentType::label)
                .collect(Collectors.joining(", "));
            out.append(color(ANSI_YELLOW, "Missing: " + missing)).append('\n');
        }

        for (ValidationIssue issue : result.issues()) {
            out.append('\n');
            String tag = issue.isError() ? color(ANSI_RED, "[ERROR]") : color(ANSI_YELLOW, "[WARNING]");
            out.append(tag).append(' ').append(issue.code()).append(": ").append(issue.message()).append('\n');
            if (issue.suggestion() != null) {
                out.append("  -> ").append(issue.suggestion()).append('\n');
            }
        }

        out.append('\n').append(color(ANSI_BOLD + ANSI_CYAN, "Power")).append('\n');
        PowerAnalysis power = result.powerAnalysis();
        out.append("  Total draw:      ").append(power.totalTdp()).append("W\n");
        out.append("  Recommended PSU: ").append(power.recommendedPsu()).append("W\n");
        if (power.currentPsu() != null) {
            out.append("  Current PSU:     ").append(power.currentPsu()).append("W (headroom ")
                .append(power.headroom()).append("W)\n");
        }
        out.append("  Load at recommended: ").append(power.efficiencyAtLoad()).append('\n');

        return out.toString();
    }

    /**
     * Renders a PSU recommendation.
     *
     * @param recommendation recommendation
     * @return report text
     */
    public String recommendation(PsuRecommendation recommendation) {
        StringBuilder out = new StringBuilder();
        out.append(color(ANSI_BOLD + ANSI_CYAN, "Power Breakdown")).append('\n');
        for (String line : recommendation.breakdown().lines()) {
            out.append("  ").append(line).append('\n');
        }
        out.append('\n');
        out.append(color(ANSI_BOLD, "Recommended PSU: " + recommendation.recommendedTier())).append('\n');
        out.append("Load at recommended: ").append(recommendation.efficiencyAtLoad()).append('\n');
        if (!recommendation.notes().isEmpty()) {
            out.append('\n');
            for (String note : recommendation.notes()) {
                out.append("  * ").append(note).append('\n');
            }
        }
        return out.toString();
    }

    /**
     * Renders one candidate classification as {@code "<status>: <message>"}.
     *
     * @param result classification
     * @return one-line report
     */
    public String compatibility(CompatibilityResult result) {
        String status = result.status().label().toUpperCase(Locale.ROOT);
        String colored = switch (result.status()) {
            case COMPATIBLE -> color(ANSI_GREEN, status);
            case WARNING -> color(ANSI_YELLOW, status);
            case INCOMPATIBLE -> color(ANSI_RED, status);
            case UNKNOWN -> status;
        };
        return result.message() == null ? colored : colored + ": " + result.message();
    }

    private String color(String code, String text) {
        return useColors ? code + text + ANSI_RESET : text;
    }
}
