package org.lqc.queryCompiler.compiler.visitors;

/** Returned by preorder methods: whether the traversal descends into the children of a node. */
public enum VisitDecision {
    STOP,
    CONTINUE;

    public boolean stop() {
        return this.equals(STOP);
    }
}
