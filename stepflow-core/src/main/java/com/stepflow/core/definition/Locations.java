package com.stepflow.core.definition;

/**
 * Formats the location of a node inside a definition, e.g.
 * {@code States.Fan.Branches[1].States.Charge}.
 */
final class Locations {

    static final String ROOT = "(root)";

    private Locations() {
    }

    static String state(String programLocation, String stateName) {
        return programLocation.isEmpty()
            ? "States." + stateName
            : programLocation + ".States." + stateName;
    }

    static String display(String location) {
        return location.isEmpty() ? ROOT : location;
    }
}
