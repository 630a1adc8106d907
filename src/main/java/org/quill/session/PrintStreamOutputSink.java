package org.quill.session;

import org.quill.interpreter.api.IOutputSink;

import java.io.PrintStream;
import java.io.PrintWriter;

/**
 * An {@link IOutputSink} that writes to a {@link PrintStream} or {@link PrintWriter}.
 */
public final class PrintStreamOutputSink implements IOutputSink {

    private final PrintWriter writer;

    public PrintStreamOutputSink(PrintStream stream) {
        this(new PrintWriter(stream, true));
    }

    public PrintStreamOutputSink(PrintWriter writer) {
        this.writer = writer;
    }

    @Override
    public void println(String text) {
        writer.println(text);
        writer.flush();
    }
}
