package org.lqc.queryCompiler.compiler.errors;

import org.lqc.queryCompiler.ir.ILQNode;

/** An error in the input supplied by the user. */
public class CompilationError extends BaseCompilerException {
    public CompilationError(String message) {
        super(message, null);
    }

    public CompilationError(String message, ILQNode node) {
        super(message, node);
    }

    public CompilationError(String message, Throwable cause) {
        super(message, null, cause);
    }

    @Override
    public String getErrorKind() {
        return "Compilation error";
    }
}
