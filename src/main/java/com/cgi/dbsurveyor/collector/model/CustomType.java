package com.cgi.dbsurveyor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;

/**
 * User-defined type (enum, composite, domain, range).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomType implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private String name;
    private String schema;

    /**
     * Enum labels, base type or other textual definition.
     */
    private String definition;

    private CustomTypeCategory category;
}
