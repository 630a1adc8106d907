package org.quill.cli.commands;

import com.typesafe.config.Config;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.quill.cli.QuillCommandLine;
import org.quill.interpreter.Interpreter;
import org.quill.interpreter.runtime.Value;
import org.quill.session.PrintStreamOutputSink;
import org.quill.session.Session;
import org.quill.session.SessionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Interactive read-eval-print loop. Every input line runs through the same {@link Session}
 * logic as a source file, so variables persist between lines until the loop ends.
 */
@Command(name = "repl", description = "Starts an interactive Quill session.")
public class ReplCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplCommand.class);
    private static final String REPL_SOURCE_NAME = "<repl>";

    @ParentCommand
    private QuillCommandLine parent;

    @Override
    public Integer call() throws IOException {
        final Config config = parent.getConfig();
        final String prompt = config.getString("quill.repl.prompt");

        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReaderBuilder builder = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory());
            if (config.hasPath("quill.repl.history-file")) {
                builder.variable(LineReader.HISTORY_FILE, Paths.get(config.getString("quill.repl.history-file")));
            }
            LineReader lineReader = builder.build();

            PrintWriter out = terminal.writer();
            Session session = new Session(new Interpreter(),
                    new PrintStreamOutputSink(out),
                    new PrintStreamOutputSink(out),
                    SessionOptions.fromConfig(config));
            session.setSourceName(REPL_SOURCE_NAME);
            return runLoop(lineReader, session, prompt, out);
        }
    }

    /**
     * Reads lines until {@code :quit}, Ctrl-D or Ctrl-C.
     *
     * @param lineReader The source of input lines.
     * @param session The session that interprets each line.
     * @param prompt The prompt shown before each line.
     * @param out The writer for REPL commands such as {@code :vars}.
     * @return The exit code, always 0.
     */
    int runLoop(LineReader lineReader, Session session, String prompt, PrintWriter out) {
        int lineNumber = 0;
        while (true) {
            final String line;
            try {
                line = lineReader.readLine(prompt);
            } catch (UserInterruptException | EndOfFileException e) {
                // Ctrl+C / Ctrl+D
                break;
            }
            if (line == null) {
                break;
            }

            switch (line.strip()) {
                case ":quit", ":exit" -> {
                    LOGGER.debug("REPL closed after {} lines.", lineNumber);
                    return 0;
                }
                case ":vars" -> printVariables(session, out);
                case ":help" -> printHelp(out);
                default -> session.processLine(line, ++lineNumber);
            }
            out.flush();
        }
        LOGGER.debug("REPL closed after {} lines.", lineNumber);
        return 0;
    }

    private void printVariables(Session session, PrintWriter out) {
        Map<String, Value> variables = session.getStore().snapshot();
        if (variables.isEmpty()) {
            out.println("(no variables)");
            return;
        }
        variables.forEach((name, value) -> out.println(name + " = " + value.toText()));
    }

    private void printHelp(PrintWriter out) {
        out.println("Enter a statement (x = 1; / print x;) or an expression (x + 1).");
        out.println("  :vars  - List all variables.");
        out.println("  :help  - Show this help message.");
        out.println("  :quit  - Leave the REPL.");
    }
}
