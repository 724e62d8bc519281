package com.spice.netlist.diagnostics;

public enum Severity {
    ERROR,
    WARNING
}
