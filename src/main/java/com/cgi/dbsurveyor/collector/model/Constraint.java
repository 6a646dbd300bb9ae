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
 * Table constraint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Constraint implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private String name;
    private String tableName;
    private String schema;
    private ConstraintType constraintType;

    @Builder.Default
    private List<String> columns = new ArrayList<>();

    /**
     * Check expression, only for {@link ConstraintType#CHECK}.
     */
    private String checkClause;
}
