package com.cgi.dbsurveyor.collector.model;

import java.util.Locale;

public enum ParameterDirection {
    IN,
    OUT,
    INOUT;

    /**
     * Parses information_schema.parameters.parameter_mode.
     *
     * @param mode Mode such as "IN", "OUT" or "INOUT"
     * @return Direction, IN when the mode is missing
     */
    public static ParameterDirection fromMode(String mode) {
        if (mode == null) {
            return IN;
        }
        return switch (mode.trim().toUpperCase(Locale.ROOT)) {
            case "OUT" -> OUT;
            case "INOUT" -> INOUT;
            default -> IN;
        };
    }
}
