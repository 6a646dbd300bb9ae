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
 * Foreign key from a table to a referenced table.
 * {@code columns} and {@code referencedColumns} are positionally paired.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForeignKey implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private String name;

    @Builder.Default
    private List<String> columns = new ArrayList<>();

    private String referencedTable;
    private String referencedSchema;

    @Builder.Default
    private List<String> referencedColumns = new ArrayList<>();

    private ReferentialAction onDelete;
    private ReferentialAction onUpdate;
}
