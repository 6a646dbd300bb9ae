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
 * Primary key of a table. Columns are kept in key declaration order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrimaryKey implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private String name;

    @Builder.Default
    private List<String> columns = new ArrayList<>();
}
