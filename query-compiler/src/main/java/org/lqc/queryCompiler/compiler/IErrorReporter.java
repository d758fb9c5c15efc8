package org.lqc.queryCompiler.compiler;

/** Interface implemented by objects which collect errors and warnings. */
public interface IErrorReporter {
    void reportProblem(boolean warning, String errorType, String message);

    default void reportError(String errorType, String message) {
        this.reportProblem(false, errorType, message);
    }

    default void reportWarning(String errorType, String message) {
        this.reportProblem(true, errorType, message);
    }

    /** True if any error (but not a warning) has been reported. */
    boolean hasErrors();
}
