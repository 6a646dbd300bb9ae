package com.cgi.dbsurveyor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored procedure or function.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Routine implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Routine name.
     */
    private String name;

    /**
     * Schema of the routine.
     */
    private String schema;

    /**
     * Procedure or function.
     */
    private RoutineKind kind;

    /**
     * Body, null when the engine hides it or it is implemented natively.
     */
    private String definition;

    /**
     * Parameters in declaration order.
     */
    @Builder.Default
    private List<Parameter> parameters = new ArrayList<>();

    /**
     * Declared return type, null for procedures.
     */
    private String returnType;

    /**
     * Implementation language (sql, plpgsql, ...).
     */
    private String language;

    private String comment;
}
