package com.cgi.dbsurveyor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;

/**
 * One key column of an index, in key order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexColumn implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private String name;
    private SortOrder sortOrder;
}
