package com.spice.netlist.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Net naming rules shared by the parser and the hierarchy resolver.
 */
public final class Nets {

    /** The single global ground net. */
    public static final String GROUND = "0";

    private Nets() {
        // Utility class
    }

    /**
     * {@code 0} and any case variant of {@code GND} denote global ground.
     */
    public static boolean isGround(String node) {
        return GROUND.equals(node) || "GND".equalsIgnoreCase(node);
    }

    public static List<String> normalizeGround(List<String> nodes) {
        List<String> result = new ArrayList<>(nodes.size());
        for (String node : nodes) {
            result.add(isGround(node) ? GROUND : node);
        }
        return result;
    }

    /**
     * Joins an instance path and a local name with '.', or returns the bare name at the root.
     */
    public static String qualify(String path, String name) {
        return (path == null || path.isEmpty()) ? name : path + "." + name;
    }
}
