package com.vcalc.latex;

/** Expression nesting exceeded the configured bound. Never swallowed. */
public class ExpressionDepthException extends VCalcException {

    private final int maxDepth;

    public ExpressionDepthException(String where, int maxDepth) {
        super(where + ": expression nesting exceeds max depth " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
