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
 * Represents a view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class View implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private String name;
    private String schema;

    /**
     * View query text (or aggregation pipeline for document stores), when readable.
     */
    private String definition;

    @Builder.Default
    private List<Column> columns = new ArrayList<>();

    private String comment;
}
