package org.quill.cli.commands;

import org.quill.cli.QuillCommandLine;
import org.quill.interpreter.Interpreter;
import org.quill.session.PrintStreamOutputSink;
import org.quill.session.Session;
import org.quill.session.SessionOptions;
import org.quill.session.SessionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "run", description = "Runs a Quill source file line by line.")
public class RunCommand implements Callable<Integer> {

    /** Exit code when at least one line failed. */
    public static final int EXIT_LINE_FAILED = 1;
    /** Exit code when the source file cannot be read. */
    public static final int EXIT_IO_ERROR = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private QuillCommandLine parent;

    @Parameters(index = "0", paramLabel = "FILE", description = "The source file to run.")
    private Path file;

    @Option(names = "--fail-fast", description = "Stop at the first line that fails.")
    private boolean failFast;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        SessionOptions options = SessionOptions.fromConfig(parent.getConfig());
        if (failFast) {
            options = options.withFailFast(true);
        }

        Session session = new Session(new Interpreter(),
                new PrintStreamOutputSink(spec.commandLine().getOut()),
                new PrintStreamOutputSink(spec.commandLine().getErr()),
                options);

        final SessionReport report;
        try {
            report = session.run(file);
        } catch (IOException e) {
            LOGGER.error("Cannot read source file {}: {}", file, e.getMessage());
            spec.commandLine().getErr().println("Cannot read source file: " + file);
            return EXIT_IO_ERROR;
        }

        LOGGER.info("Processed {} lines of {}, {} failed.", report.linesProcessed(), file, report.linesFailed());
        return report.isSuccessful() ? 0 : EXIT_LINE_FAILED;
    }
}
