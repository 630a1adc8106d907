package org.quill.interpreter.api;

/**
 * Receives the program output of a session: printed values, echoed comments and
 * the values of lines evaluated as bare expressions.
 */
@FunctionalInterface
public interface IOutputSink {

    /**
     * Writes one line of program output.
     * @param text The text, without line terminator.
     */
    void println(String text);
}
