package org.lqc.queryCompiler.compiler.errors;

import org.lqc.queryCompiler.ir.ILQNode;

import javax.annotation.Nullable;

/** Base class for all exceptions thrown by the compiler. */
public abstract class BaseCompilerException extends RuntimeException {
    /** Node that caused the problem, if known. */
    @Nullable
    public final ILQNode node;

    protected BaseCompilerException(String message, @Nullable ILQNode node, @Nullable Throwable cause) {
        super(message, cause);
        this.node = node;
    }

    protected BaseCompilerException(String message, @Nullable ILQNode node) {
        this(message, node, null);
    }

    public abstract String getErrorKind();
}
