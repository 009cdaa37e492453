package org.pyoptimizer.analysis;

import org.pyoptimizer.astnode.*;
import org.pyoptimizer.astvisitor.NameUsageVisitor;
import org.pyoptimizer.astvisitor.PrintVisitor;
import org.pyoptimizer.astvisitor.TraversingVisitor;
import org.pyoptimizer.model.Anchor;
import org.pyoptimizer.model.Evidence;
import org.pyoptimizer.model.Finding;
import org.pyoptimizer.model.FindingKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;

/**
 * Walks a syntax tree and reports instances of the known inefficiency patterns.
 * <p>
 * The analysis is read-only and deterministic: the same tree always yields the same
 * findings, ordered by source position. Loops and calls that do not fit a pattern
 * are silently skipped.
 */
public class StaticPatternAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(StaticPatternAnalyzer.class);
    private static final boolean TRACE = "1".equals(System.getenv("PYOPT_TRACE_ANALYZER"));

    private final long highIterationThreshold;

    public StaticPatternAnalyzer(long highIterationThreshold) {
        this.highIterationThreshold = highIterationThreshold;
    }

    /**
     * Analyzes one parsed script.
     *
     * @param tree the script; not modified
     * @return the findings sorted by anchor position, then by kind
     */
    public List<Finding> analyze(SyntaxTree tree) {
        if (TRACE) {
            PrintVisitor printer = new PrintVisitor();
            tree.root.accept(printer);
            System.err.println("analyze " + tree.fileName + "\n" + printer.getResult());
        }
        List<Finding> findings = new ArrayList<>();
        Set<Integer> coveredInnerLoops = new HashSet<>();
        for (ForNode loop : countedLoops(tree.root)) {
            highIteration(loop, findings);
            ElementwiseLoop twoLevel = ElementwiseMatcher.matchTwoLevel(loop);
            if (twoLevel != null) {
                findings.add(vectorizable(twoLevel));
                coveredInnerLoops.add(twoLevel.innerLoop().getId());
                continue;
            }
            nested(loop, findings);
            if (!coveredInnerLoops.contains(loop.getId())) {
                ElementwiseLoop oneLevel = ElementwiseMatcher.matchOneLevel(loop);
                if (oneLevel != null) {
                    findings.add(vectorizable(oneLevel));
                }
            }
        }
        findings.addAll(RepeatedCallDetector.detect(tree.root));
        findings.sort(Comparator.comparing((Finding finding) -> finding.anchor().span())
                .thenComparing(Finding::kind));
        if (log.isDebugEnabled()) {
            for (Finding finding : findings) {
                log.debug("{}: {}", tree.fileName, finding);
            }
        }
        log.info("{}: {} finding(s)", tree.fileName, findings.size());
        return findings;
    }

    private static List<ForNode> countedLoops(ModuleNode module) {
        List<ForNode> loops = new ArrayList<>();
        module.accept(new TraversingVisitor() {
            @Override
            public void visit(ForNode node) {
                if (LoopShapes.isCountedLoop(node)) {
                    loops.add(node);
                }
                visitChildren(node);
            }
        });
        return loops;
    }

    private void highIteration(ForNode loop, List<Finding> findings) {
        BigInteger iterations = ConstantEvaluator.rangeLength(LoopShapes.rangeCall(loop).arguments);
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put(Evidence.LOOP_VARIABLE, LoopShapes.loopVariable(loop));
        if (iterations == null) {
            evidence.put(Evidence.CONFIDENCE, Evidence.LOW);
        } else if (iterations.compareTo(BigInteger.valueOf(highIterationThreshold)) > 0) {
            evidence.put(Evidence.CONFIDENCE, Evidence.HIGH);
            evidence.put(Evidence.ESTIMATED_ITERATIONS, iterations);
        } else {
            return;
        }
        findings.add(new Finding(FindingKind.HIGH_ITERATION_LOOP, Anchor.of(loop), evidence));
    }

    /**
     * Reports the first counted loop directly inside the body whose bounds the outer
     * body cannot change, other than through the outer index.
     */
    private static void nested(ForNode outer, List<Finding> findings) {
        String outerVariable = LoopShapes.loopVariable(outer);
        NameUsageVisitor outerBody = NameUsageVisitor.scan(outer.body);
        for (Node statement : outer.body.elements) {
            if (!LoopShapes.isCountedLoop(statement)) {
                continue;
            }
            ForNode inner = (ForNode) statement;
            NameUsageVisitor bounds = NameUsageVisitor.scan(LoopShapes.rangeCall(inner));
            boolean dependsOnOuter = false;
            boolean stable = true;
            for (String name : bounds.getLoaded()) {
                if (name.equals(outerVariable)) {
                    dependsOnOuter = true;
                } else if (outerBody.mayChange(name)) {
                    stable = false;
                }
            }
            if (!stable) {
                continue;
            }
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put(Evidence.OUTER_VARIABLE, outerVariable);
            evidence.put(Evidence.INNER_VARIABLE, LoopShapes.loopVariable(inner));
            evidence.put(Evidence.PERFECTLY_NESTED, outer.body.elements.size() == 1);
            evidence.put(Evidence.INNER_DEPENDS_ON_OUTER, dependsOnOuter);
            findings.add(new Finding(FindingKind.NESTED_LOOP, Anchor.of(outer), evidence));
            return;
        }
    }

    private static Finding vectorizable(ElementwiseLoop match) {
        Set<String> containers = new LinkedHashSet<>();
        for (ElementwiseStatement statement : match.elementwise()) {
            containers.add(statement.container());
            containers.addAll(statement.containersRead());
        }
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put(Evidence.LOOP_VARIABLE, String.join(", ", match.indices()));
        evidence.put(Evidence.DIMENSIONS, match.dimensions());
        evidence.put(Evidence.CONTAINERS, new ArrayList<>(containers));
        evidence.put(Evidence.VECTORIZABLE_STATEMENTS, match.elementwise().size());
        evidence.put(Evidence.TOTAL_STATEMENTS, match.body().size());
        return new Finding(FindingKind.VECTORIZABLE_LOOP, Anchor.of(match.loop()), evidence);
    }
}
