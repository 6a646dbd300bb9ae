package com.cgi.dbsurveyor.collector.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;

/**
 * Whether a run targeted one database or a whole server.
 * The counters are only set for MULTI_DATABASE.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CollectionMode implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public enum Mode {
        SINGLE_DATABASE,
        MULTI_DATABASE
    }

    private final Mode mode;
    private final Integer discovered;
    private final Integer collected;
    private final Integer failed;

    private CollectionMode(Mode mode, Integer discovered, Integer collected, Integer failed) {
        this.mode = mode;
        this.discovered = discovered;
        this.collected = collected;
        this.failed = failed;
    }

    public static CollectionMode singleDatabase() {
        return new CollectionMode(Mode.SINGLE_DATABASE, null, null, null);
    }

    public static CollectionMode multiDatabase(int discovered, int collected, int failed) {
        return new CollectionMode(Mode.MULTI_DATABASE, discovered, collected, failed);
    }
}
