package de.bsommerfeld.sparkle.db;

import java.util.List;

/**
 * Outcome of a {@link DataValidator#check()} audit.
 *
 * @param totalThemes          number of theme rows
 * @param totalInspirations    number of inspiration rows
 * @param orphanedInspirations inspirations whose theme does not exist
 * @param issues               integrity violations; any entry makes the
 *                             result invalid
 * @param warnings             suspicious but legal states
 */
public record DataValidationResult(
        int totalThemes,
        int totalInspirations,
        int orphanedInspirations,
        List<String> issues,
        List<String> warnings) {

    static final int REPORTED_WARNINGS = 5;

    public DataValidationResult {
        issues = List.copyOf(issues);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return issues.isEmpty();
    }

    /**
     * Renders a plain-text summary. Only the first five warnings are listed;
     * the rest are summarized in a single line.
     */
    public String toReport() {
        StringBuilder report = new StringBuilder();
        report.append("Data integrity report\n");
        report.append("=".repeat(30)).append('\n');
        report.append("Themes: ").append(totalThemes).append('\n');
        report.append("Inspirations: ").append(totalInspirations).append('\n');
        report.append("Orphaned inspirations: ").append(orphanedInspirations).append('\n');
        report.append("Status: ").append(isValid() ? "VALID" : "ISSUES FOUND").append('\n');

        if (!issues.isEmpty()) {
            report.append("\nIssues:\n");
            for (String issue : issues)
                report.append("  - ").append(issue).append('\n');
        }

        if (!warnings.isEmpty()) {
            report.append("\nWarnings:\n");
            warnings.stream().limit(REPORTED_WARNINGS)
                    .forEach(warning -> report.append("  - ").append(warning).append('\n'));
            if (warnings.size() > REPORTED_WARNINGS)
                report.append("  ... and ").append(warnings.size() - REPORTED_WARNINGS).append(" more warnings\n");
        }

        if (isValid() && warnings.isEmpty())
            report.append("\nAll checks passed.\n");
        return report.toString();
    }
}
