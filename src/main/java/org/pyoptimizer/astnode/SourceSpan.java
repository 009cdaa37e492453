package org.pyoptimizer.astnode;

/**
 * Region of the original source covered by a node: 1-based lines, 0-based columns,
 * end exclusive. Nodes synthesized by a rewrite have {@link #UNKNOWN}.
 */
public record SourceSpan(int startLine, int startColumn, int endLine, int endColumn) implements Comparable<SourceSpan> {

    public static final SourceSpan UNKNOWN = new SourceSpan(0, 0, 0, 0);

    public boolean isKnown() {
        return startLine > 0;
    }

    public boolean overlaps(SourceSpan other) {
        if (!isKnown() || !other.isKnown()) {
            return false;
        }
        return comparePositions(startLine, startColumn, other.endLine, other.endColumn) < 0
                && comparePositions(other.startLine, other.startColumn, endLine, endColumn) < 0;
    }

    public boolean contains(SourceSpan other) {
        return isKnown() && other.isKnown()
                && comparePositions(startLine, startColumn, other.startLine, other.startColumn) <= 0
                && comparePositions(other.endLine, other.endColumn, endLine, endColumn) <= 0;
    }

    public SourceSpan withEnd(int line, int column) {
        return new SourceSpan(startLine, startColumn, line, column);
    }

    /**
     * Orders by start position, and for equal starts the longer span first, which is
     * the outer-to-inner order used when patches are applied.
     */
    @Override
    public int compareTo(SourceSpan other) {
        int byStart = comparePositions(startLine, startColumn, other.startLine, other.startColumn);
        if (byStart != 0) {
            return byStart;
        }
        return comparePositions(other.endLine, other.endColumn, endLine, endColumn);
    }

    private static int comparePositions(int lineA, int columnA, int lineB, int columnB) {
        if (lineA != lineB) {
            return Integer.compare(lineA, lineB);
        }
        return Integer.compare(columnA, columnB);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
