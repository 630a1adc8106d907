package org.quill.session;

import org.quill.interpreter.diagnostics.Diagnostic;

import java.util.List;

/**
 * Summary of a {@link Session#run} call.
 *
 * @param linesProcessed The number of lines handed to the session, comments and blank lines included.
 * @param linesFailed The number of lines that failed.
 * @param diagnostics The diagnostics of the failed lines, in source order.
 */
public record SessionReport(
        int linesProcessed,
        int linesFailed,
        List<Diagnostic> diagnostics
) {
    public boolean isSuccessful() {
        return linesFailed == 0;
    }
}
