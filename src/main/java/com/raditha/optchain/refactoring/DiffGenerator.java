package com.raditha.optchain.refactoring;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for rewrite previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    public static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between the original and the previewed source.
     *
     * @param fileName name shown in the diff headers
     * @param original original source text
     * @param revised  source text with rewrites applied
     * @return unified diff, empty when nothing changed
     */
    public String generateUnifiedDiff(String fileName, String original, String revised) {
        return generateUnifiedDiff(fileName, original, revised, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String fileName, String original, String revised, int contextLines) {
        List<String> originalLines = lines(original);
        List<String> revisedLines = lines(revised);

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\n", -1));
    }
}
