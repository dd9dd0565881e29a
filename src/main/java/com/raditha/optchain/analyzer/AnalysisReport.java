package com.raditha.optchain.analyzer;

import com.raditha.optchain.config.DetectorConfig;
import com.raditha.optchain.model.Diagnostic;
import com.raditha.optchain.model.DiagnosticKind;
import com.raditha.optchain.model.ExpressionTree;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Report containing optional chain findings for one file.
 */
public record AnalysisReport(
        @Nullable Path sourceFile,
        ExpressionTree tree,
        List<Diagnostic> diagnostics,
        int combinatorRuns,
        DetectorConfig config) {

    /**
     * Get count of diagnostics found.
     */
    public int getDiagnosticCount() {
        return diagnostics.size();
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * Count diagnostics of one kind.
     */
    public long count(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).count();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(
                "Found %d diagnostics (%d mergeable chains, %d empty-object fallbacks) in %d combinator runs",
                diagnostics.size(),
                count(DiagnosticKind.MERGEABLE_CHAIN),
                count(DiagnosticKind.EMPTY_OBJECT_FALLBACK),
                combinatorRuns);
    }

    /**
     * Get detailed report string.
     */
    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(80)).append("\n");
        sb.append("OPTIONAL CHAIN REPORT\n");
        sb.append("=".repeat(80)).append("\n\n");

        sb.append("File: ").append(sourceFile == null ? "<unknown>" : sourceFile).append("\n");
        sb.append("Configuration: ").append(config.describe()).append("\n");
        sb.append("\n");

        sb.append(getSummary()).append("\n\n");

        if (diagnostics.isEmpty()) {
            sb.append("No optional chain candidates found.\n");
            return sb.toString();
        }

        sb.append("Diagnostics (in source order):\n");
        sb.append("-".repeat(80)).append("\n\n");
        for (int i = 0; i < diagnostics.size(); i++) {
            Diagnostic diagnostic = diagnostics.get(i);
            sb.append(String.format("#%d %s at %s %s%n",
                    i + 1,
                    diagnostic.kind().id(),
                    tree.position(diagnostic.rangeStart()),
                    diagnostic.range().toDisplayString()));
            sb.append("  ").append(diagnostic.message()).append("\n");
            String code = snippet(diagnostic);
            if (!code.isEmpty()) {
                sb.append("  Code: ").append(code).append("\n");
            }
            if (diagnostic.hasSuggestion()) {
                sb.append("  Suggestion: ").append(diagnostic.suggestedRewrite()).append("\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    /**
     * Source snippet covered by a diagnostic.
     */
    public String snippet(Diagnostic diagnostic) {
        return tree.sourceText()
                .filter(text -> diagnostic.range().isKnown() && diagnostic.rangeEnd() <= text.length())
                .map(text -> text.substring(diagnostic.rangeStart(), diagnostic.rangeEnd()))
                .orElse("");
    }
}
