package com.locus.runner;

/**
 * Interprets a CLI's stdout one line at a time. One instance per execution.
 */
public interface StreamParser {

    void onLine(String line);

    /** Called once at end of stream. */
    default void finish() {}

    /** Output accumulated so far. */
    String output();
}
