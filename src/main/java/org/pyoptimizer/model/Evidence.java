package org.pyoptimizer.model;

/**
 * Keys of the evidence maps attached to findings.
 */
public final class Evidence {
    public static final String CONFIDENCE = "confidence";
    public static final String ESTIMATED_ITERATIONS = "estimatedIterations";
    public static final String LOOP_VARIABLE = "loopVariable";
    public static final String OUTER_VARIABLE = "outerVariable";
    public static final String INNER_VARIABLE = "innerVariable";
    public static final String PERFECTLY_NESTED = "perfectlyNested";
    public static final String INNER_DEPENDS_ON_OUTER = "innerBoundDependsOnOuterIndex";
    public static final String CALLEE = "callee";
    public static final String SIGNATURE = "signature";
    public static final String CALL_SITE_LINES = "callSiteLines";
    public static final String CONTAINERS = "containers";
    public static final String VECTORIZABLE_STATEMENTS = "vectorizableStatements";
    public static final String TOTAL_STATEMENTS = "totalStatements";
    public static final String DIMENSIONS = "dimensions";
    public static final String LINE = "line";

    public static final String HIGH = "HIGH";
    public static final String LOW = "LOW";

    private Evidence() {
    }
}
