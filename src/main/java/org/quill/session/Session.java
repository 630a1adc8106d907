package org.quill.session;

import org.quill.interpreter.api.ExecutionResult;
import org.quill.interpreter.api.IInterpreter;
import org.quill.interpreter.api.IOutputSink;
import org.quill.interpreter.api.InterpreterErrorCode;
import org.quill.interpreter.diagnostics.Diagnostic;
import org.quill.interpreter.diagnostics.DiagnosticsEngine;
import org.quill.interpreter.runtime.VariableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Drives the interpreter over the lines of one program or interactive session.
 * <p>
 * A session owns the {@link VariableStore}; it is created once and shared by every line.
 * For each line the session
 * <ol>
 *     <li>echoes {@code //} comment lines instead of interpreting them,</li>
 *     <li>runs the line as a statement,</li>
 *     <li>if that fails, retries the line from scratch as an expression and prints its value,</li>
 *     <li>if both fail, records the diagnostic and carries on with the next line.</li>
 * </ol>
 * Statements are never printed by the session: {@code print} writes its own output.
 * Not thread-safe.
 */
public class Session {

    private static final Logger log = LoggerFactory.getLogger(Session.class);
    private static final String COMMENT_MARKER = "//";

    private final IInterpreter interpreter;
    private final VariableStore store;
    private final IOutputSink output;
    private final IOutputSink errors;
    private final SessionOptions options;
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private String sourceName = "<input>";

    /**
     * Creates a new session with an empty variable store.
     * @param interpreter The interpreter that runs each line.
     * @param output The sink for program output.
     * @param errors The sink for error reports of failed lines.
     * @param options The session settings.
     */
    public Session(IInterpreter interpreter, IOutputSink output, IOutputSink errors, SessionOptions options) {
        this(interpreter, new VariableStore(), output, errors, options);
    }

    /**
     * Creates a new session over an existing variable store.
     * @param interpreter The interpreter that runs each line.
     * @param store The variable store shared by all lines.
     * @param output The sink for program output.
     * @param errors The sink for error reports of failed lines.
     * @param options The session settings.
     */
    public Session(IInterpreter interpreter, VariableStore store, IOutputSink output, IOutputSink errors, SessionOptions options) {
        this.interpreter = interpreter;
        this.store = store;
        this.output = output;
        this.errors = errors;
        this.options = options;
    }

    /**
     * Processes a single line.
     *
     * @param line The raw source line.
     * @param lineNumber The 1-based line number, used in diagnostics.
     * @return The outcome of the line. Comment and blank lines succeed without a value.
     */
    public ExecutionResult processLine(String line, int lineNumber) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return ExecutionResult.noValue();
        }
        if (trimmed.startsWith(COMMENT_MARKER)) {
            if (options.echoComments()) {
                output.println(options.commentPrefix() + trimmed.substring(COMMENT_MARKER.length()));
            }
            return ExecutionResult.noValue();
        }

        ExecutionResult statementResult = interpreter.executeStatement(line, store, output);
        if (statementResult.isSuccess()) {
            return statementResult;
        }

        Diagnostic reported = statementResult.diagnostic();
        if (options.fallbackToExpression()) {
            log.debug("Line {} is not a valid statement ({}), retrying as expression.", lineNumber, reported.code());
            ExecutionResult expressionResult = interpreter.evaluateExpression(line, store);
            if (expressionResult.isSuccess()) {
                expressionResult.getValue().ifPresent(value -> output.println(value.toText()));
                return expressionResult;
            }
            // UNRECOGNIZED_STATEMENT defers to the expression diagnostic.
            if (reported.code() == InterpreterErrorCode.UNRECOGNIZED_STATEMENT) {
                reported = expressionResult.diagnostic();
            }
        }

        Diagnostic located = reported.at(sourceName, lineNumber);
        diagnostics.report(located);
        log.debug("Line {} of {} failed: {}", lineNumber, sourceName, located.message());
        errors.println("Error: " + located);
        return ExecutionResult.failure(located);
    }

    /**
     * Processes all lines in order.
     *
     * @param lines The source lines.
     * @return A report of the run.
     */
    public SessionReport run(List<String> lines) {
        int failuresBefore = diagnostics.getDiagnostics().size();
        int processed = 0;
        for (String line : lines) {
            processed++;
            ExecutionResult result = processLine(line, processed);
            if (!result.isSuccess() && options.failFast()) {
                log.info("Stopping after line {} because fail-fast is enabled.", processed);
                break;
            }
        }
        List<Diagnostic> failures = diagnostics.getDiagnostics().subList(failuresBefore, diagnostics.getDiagnostics().size());
        return new SessionReport(processed, failures.size(), List.copyOf(failures));
    }

    /**
     * Reads a UTF-8 source file and processes all of its lines.
     *
     * @param file The source file.
     * @return A report of the run.
     * @throws IOException if the file cannot be read.
     */
    public SessionReport run(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        log.debug("Running {} ({} lines)", file, lines.size());
        String previousName = sourceName;
        sourceName = file.getFileName().toString();
        try {
            return run(lines);
        } finally {
            sourceName = previousName;
        }
    }

    /**
     * Sets the name used for this session's source in diagnostics.
     * @param sourceName The source name, e.g. "&lt;repl&gt;".
     */
    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }

    public VariableStore getStore() {
        return store;
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
