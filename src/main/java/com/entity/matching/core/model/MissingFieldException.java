package com.entity.matching.core.model;

/**
 * Thrown when a row is asked for a field it does not carry.
 */
public class MissingFieldException extends StructuralException {

    private final String field;

    public MissingFieldException(String field) {
        super("Field '" + field + "' does not exist in row");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
