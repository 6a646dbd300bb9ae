package com.cgi.dbsurveyor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;

/**
 * Routine parameter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Parameter implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private String name;

    /**
     * Native type name.
     */
    private String dataType;

    private ParameterDirection direction;
    private String defaultValue;
}
