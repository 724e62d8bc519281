package com.spice.netlist.parser;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Turns raw netlist text into logical lines.
 *
 * Handles SPICE conventions:
 * - '*' in the first column: full-line comment
 * - '$': inline comment, rest of the line is dropped (comment-coded CDL parameters included)
 * - '+' in the first column: continuation of the previous logical line
 *
 * Lines are produced lazily; the iterator is single-use.
 */
public class SpiceLineJoiner implements Iterator<LogicalLine> {

    private final String[] lines;
    private int index = 0;

    private StringBuilder buffer;
    private int bufferStart;
    private LogicalLine pending;

    public SpiceLineJoiner(String source) {
        this.lines = source == null ? new String[0] : source.split("\\R", -1);
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public LogicalLine next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        LogicalLine line = pending;
        pending = null;
        return line;
    }

    private LogicalLine advance() {
        while (index < lines.length) {
            int lineNumber = index + 1;
            String line = stripComments(lines[index++]);

            if (line.isEmpty()) {
                continue;
            }

            if (line.charAt(0) == '+') {
                String content = line.substring(1).strip();
                if (buffer != null && buffer.length() > 0) {
                    if (!content.isEmpty()) {
                        buffer.append(' ').append(content);
                    }
                } else {
                    // Continuation with nothing to continue: start a new statement
                    buffer = new StringBuilder(content);
                    bufferStart = lineNumber;
                }
                continue;
            }

            LogicalLine flushed = flush();
            buffer = new StringBuilder(line);
            bufferStart = lineNumber;
            if (flushed != null) {
                return flushed;
            }
        }
        return flush();
    }

    private LogicalLine flush() {
        if (buffer == null || buffer.length() == 0) {
            buffer = null;
            return null;
        }
        LogicalLine line = new LogicalLine(bufferStart, buffer.toString());
        buffer = null;
        return line;
    }

    /**
     * Removes full-line and inline comments and surrounding whitespace.
     */
    static String stripComments(String raw) {
        String line = raw.strip();
        if (line.isEmpty() || line.charAt(0) == '*') {
            return "";
        }
        int dollar = line.indexOf('$');
        if (dollar >= 0) {
            line = line.substring(0, dollar).strip();
        }
        return line;
    }
}
