package com.cgi.dbsurveyor.collector.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * Outcome of collecting one database.
 * Exactly one of the four states; {@code errors} is only filled for PARTIAL,
 * {@code message} holds the error for FAILED and the reason for SKIPPED.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class CollectionStatus implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public enum State {
        SUCCESS,
        PARTIAL,
        FAILED,
        SKIPPED
    }

    private static final CollectionStatus SUCCESS = new CollectionStatus(State.SUCCESS, List.of(), null);

    private final State state;
    private final List<String> errors;
    private final String message;

    private CollectionStatus(State state, List<String> errors, String message) {
        this.state = state;
        this.errors = errors;
        this.message = message;
    }

    public static CollectionStatus success() {
        return SUCCESS;
    }

    /**
     * Some schema object classes could not be read.
     *
     * @param errors One entry per unreadable object class
     * @return Partial status, or success when the list is empty
     */
    public static CollectionStatus partial(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            return SUCCESS;
        }
        return new CollectionStatus(State.PARTIAL, List.copyOf(errors), null);
    }

    public static CollectionStatus failed(String error) {
        return new CollectionStatus(State.FAILED, List.of(), error);
    }

    public static CollectionStatus skipped(String reason) {
        return new CollectionStatus(State.SKIPPED, List.of(), reason);
    }

    public boolean isSuccess() {
        return state == State.SUCCESS;
    }

    public boolean isFailed() {
        return state == State.FAILED;
    }
}
