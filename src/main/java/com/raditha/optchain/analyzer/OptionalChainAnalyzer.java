package com.raditha.optchain.analyzer;

import com.raditha.optchain.analysis.LooseBooleanChecker;
import com.raditha.optchain.analysis.TypeService;
import com.raditha.optchain.chain.ChainAnalyzer;
import com.raditha.optchain.config.DetectorConfig;
import com.raditha.optchain.extraction.LogicalFlattener;
import com.raditha.optchain.extraction.OperandClassifier;
import com.raditha.optchain.fallback.EmptyObjectFallbackDetector;
import com.raditha.optchain.model.Diagnostic;
import com.raditha.optchain.model.ExpressionTree;
import com.raditha.optchain.model.LogicalOperator;
import com.raditha.optchain.model.NodeKind;
import com.raditha.optchain.model.Operand;
import com.raditha.optchain.model.ValidOperand;
import com.raditha.optchain.similarity.StructuralComparator;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Main orchestrator for optional chain detection.
 * Walks one tree once: empty-object fallbacks first, then every remaining
 * {@code &&} and {@code ||} run is flattened, classified and chain analyzed.
 */
public class OptionalChainAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(OptionalChainAnalyzer.class);

    private static final Comparator<Diagnostic> BY_RANGE = Comparator
            .comparingInt(Diagnostic::rangeStart)
            .thenComparingInt(Diagnostic::rangeEnd);

    private final DetectorConfig config;

    /**
     * Create analyzer with default configuration.
     */
    public OptionalChainAnalyzer() {
        this(DetectorConfig.defaults());
    }

    public OptionalChainAnalyzer(DetectorConfig config) {
        this.config = config;
    }

    /**
     * Analyze one tree.
     *
     * @param tree        the expression tree
     * @param typeService inferred types for the nodes of {@code tree}
     * @param sourceFile  file the tree came from, for reporting only
     * @return diagnostics ordered by source range
     */
    public AnalysisReport analyze(ExpressionTree tree, TypeService typeService, @Nullable Path sourceFile) {
        // Per-pass state: the comparator cache must not outlive this tree
        StructuralComparator comparator = new StructuralComparator(tree);
        LogicalFlattener flattener = new LogicalFlattener(tree);
        OperandClassifier classifier = new OperandClassifier(tree, new LooseBooleanChecker(config, typeService));
        ChainAnalyzer chainAnalyzer = new ChainAnalyzer(comparator);
        EmptyObjectFallbackDetector fallbackDetector = new EmptyObjectFallbackDetector(tree);

        // Step 1: collect every logical node, outermost first
        Set<Integer> workQueue = new LinkedHashSet<>();
        for (int id : tree.preOrder()) {
            if (tree.kind(id) == NodeKind.LOGICAL) {
                workQueue.add(id);
            }
        }

        // Step 2: empty-object fallbacks claim their node
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (int id : List.copyOf(workQueue)) {
            Optional<Diagnostic> fallback = fallbackDetector.detect(id);
            if (fallback.isPresent()) {
                diagnostics.add(fallback.get());
                workQueue.remove(id);
            }
        }

        // Step 3: chain analysis of the remaining && and || runs
        int runs = 0;
        for (int id : List.copyOf(workQueue)) {
            if (!workQueue.contains(id)) {
                continue;
            }
            LogicalOperator operator = LogicalOperator.of(tree.node(id));
            if (operator == LogicalOperator.NULLISH) {
                workQueue.remove(id);
                continue;
            }
            LogicalFlattener.FlattenedRun run = flattener.flatten(id);
            workQueue.removeAll(run.consumed());
            runs++;

            List<ValidOperand> segment = new ArrayList<>();
            for (Operand operand : classifier.classify(run)) {
                if (operand.isValid()) {
                    segment.add((ValidOperand) operand);
                } else {
                    diagnostics.addAll(chainAnalyzer.analyze(operator, segment));
                    segment = new ArrayList<>();
                }
            }
            diagnostics.addAll(chainAnalyzer.analyze(operator, segment));
        }

        diagnostics.sort(BY_RANGE);
        logger.debug("Analyzed {} combinator runs in {}: {} diagnostics, {} cached comparisons",
                runs, sourceFile, diagnostics.size(), comparator.cacheSize());
        return new AnalysisReport(sourceFile, tree, List.copyOf(diagnostics), runs, config);
    }

    public AnalysisReport analyze(ExpressionTree tree, TypeService typeService) {
        return analyze(tree, typeService, null);
    }

    public DetectorConfig getConfig() {
        return config;
    }
}
