package com.cgi.dbsurveyor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;

/**
 * Table trigger. A trigger firing on several events is reported once per event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trigger implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private String name;
    private String tableName;
    private String schema;
    private TriggerEvent event;
    private TriggerTiming timing;
    private String definition;
}
