package com.spice.netlist.parser;

import lombok.Value;

/**
 * A statement after comment removal and continuation merging, tagged with the
 * 1-based number of the physical line it started on.
 */
@Value
public class LogicalLine {
    int lineNumber;
    String text;
}
