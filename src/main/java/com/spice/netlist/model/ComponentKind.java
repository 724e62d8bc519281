package com.spice.netlist.model;

/**
 * Closed set of component variants. The tag is the name used in statistics reports.
 */
public enum ComponentKind {
    RESISTOR("Resistor"),
    CAPACITOR("Capacitor"),
    INDUCTOR("Inductor"),
    MOSFET("Mosfet"),
    BJT("Bjt"),
    DIODE("Diode"),
    VOLTAGE_SOURCE("VoltageSource"),
    CURRENT_SOURCE("CurrentSource"),
    SUBCKT_INSTANCE("SubcktInstance");

    private final String tag;

    ComponentKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public boolean isTransistor() {
        return this == MOSFET || this == BJT;
    }
}
