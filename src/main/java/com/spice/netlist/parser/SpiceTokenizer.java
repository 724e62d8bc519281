package com.spice.netlist.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a logical line into whitespace-separated tokens.
 *
 * A single-quoted run is never split, so HSPICE expressions such as {@code w='1u + 2u'}
 * stay one token together with anything glued to the quotes. An unterminated quote runs
 * to the end of the line.
 */
public class SpiceTokenizer {

    private final String line;

    public SpiceTokenizer(String line) {
        this.line = line == null ? "" : line;
    }

    public List<String> tokenize() {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);

            if (c == '\'') {
                inQuote = !inQuote;
                current.append(c);
            } else if (!inQuote && Character.isWhitespace(c)) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }

        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
