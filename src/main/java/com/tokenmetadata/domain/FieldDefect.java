package com.tokenmetadata.domain;

/**
 * One field-level problem found during validation.
 */
public record FieldDefect(String field, Kind kind, String detail) {

    public enum Kind {
        MISSING,
        MALFORMED
    }

    public static FieldDefect missing(String field) {
        return new FieldDefect(field, Kind.MISSING, "required field not present");
    }

    public static FieldDefect malformed(String field, String detail) {
        return new FieldDefect(field, Kind.MALFORMED, detail);
    }
}
