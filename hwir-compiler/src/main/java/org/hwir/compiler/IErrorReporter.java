package org.hwir.compiler;

import org.hwir.compiler.errors.SourcePositionRange;

/** Interface for reporting errors. */
public interface IErrorReporter {
    /** Report a problem (error or warning).
     *
     * @param range     Source position where the problem occurred.
     * @param warning   If true, this is a warning.
     * @param errorType Type of error.
     * @param message   Message to report.
     */
    void reportProblem(SourcePositionRange range, boolean warning,
                       String errorType, String message);

    default void reportError(SourcePositionRange range, String errorType, String message) {
        this.reportProblem(range, false, errorType, message);
    }

    default void reportWarning(SourcePositionRange range, String errorType, String message) {
        this.reportProblem(range, true, errorType, message);
    }

    /** True if any error (but not a warning) has been reported. */
    boolean hasErrors();
}
