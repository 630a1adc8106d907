package org.quill.cli.commands;

import org.quill.cli.QuillCommandLine;
import org.quill.interpreter.Interpreter;
import org.quill.interpreter.api.InterpreterErrorCode;
import org.quill.interpreter.api.InterpreterException;
import org.quill.interpreter.diagnostics.Diagnostic;
import org.quill.interpreter.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Parses every line of a source file without evaluating anything and reports lexical and
 * syntax errors. Lines are accepted the same way {@code run} accepts them: as a statement,
 * or failing that as an expression.
 */
@Command(name = "check", description = "Checks the syntax of a Quill source file without running it.")
public class CheckCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CheckCommand.class);

    @ParentCommand
    private QuillCommandLine parent;

    @Parameters(index = "0", paramLabel = "FILE", description = "The source file to check.")
    private Path file;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        parent.getConfig();
        final List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.error("Cannot read source file {}: {}", file, e.getMessage());
            spec.commandLine().getErr().println("Cannot read source file: " + file);
            return RunCommand.EXIT_IO_ERROR;
        }

        Interpreter interpreter = new Interpreter();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String sourceName = file.getFileName().toString();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("//")) {
                continue;
            }
            try {
                interpreter.parseStatement(line);
            } catch (InterpreterException statementError) {
                try {
                    interpreter.parseExpression(line);
                } catch (InterpreterException expressionError) {
                    InterpreterException reported = statementError.getCode() == InterpreterErrorCode.UNRECOGNIZED_STATEMENT
                            ? expressionError : statementError;
                    diagnostics.report(Diagnostic.from(reported, sourceName, i + 1));
                }
            }
        }

        PrintWriter out = spec.commandLine().getOut();
        if (diagnostics.hasErrors()) {
            out.println(diagnostics.summary());
            return RunCommand.EXIT_LINE_FAILED;
        }
        out.println(sourceName + ": no syntax errors in " + lines.size() + " lines.");
        return 0;
    }
}
