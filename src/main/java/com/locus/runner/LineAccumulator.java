package com.locus.runner;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a chunked character stream into complete lines.
 *
 * <p>A trailing partial line is held back until a later chunk completes it,
 * so NDJSON records are never parsed half-written. Not thread-safe.
 */
public class LineAccumulator {

    private final StringBuilder pending = new StringBuilder();

    /**
     * Appends a chunk and returns every line it completed, without line terminators.
     */
    public List<String> feed(CharSequence chunk) {
        var lines = new ArrayList<String>();
        pending.append(chunk);
        int start = 0;
        for (int i = 0; i < pending.length(); i++) {
            if (pending.charAt(i) == '\n') {
                int end = i > start && pending.charAt(i - 1) == '\r' ? i - 1 : i;
                lines.add(pending.substring(start, end));
                start = i + 1;
            }
        }
        pending.delete(0, start);
        return lines;
    }

    /**
     * Returns the unterminated remainder at end of stream and resets.
     */
    public String flush() {
        var rest = pending.toString();
        pending.setLength(0);
        return rest;
    }

    public boolean hasPending() {
        return pending.length() > 0;
    }
}
