package com.tokenmetadata.ingestion.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * A canonical field of a schema family.
 *
 * @param name     canonical key written to the normalized record
 * @param aliases  keys other producers use for the same field, checked after {@code name} in order
 * @param type     expected type
 * @param required a missing required field is a MISSING defect
 */
public record FieldSpec(String name, List<String> aliases, FieldType type, boolean required) {

    public FieldSpec {
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
    }

    public static FieldSpec required(String name, FieldType type, String... aliases) {
        return new FieldSpec(name, List.of(aliases), type, true);
    }

    public static FieldSpec optional(String name, FieldType type, String... aliases) {
        return new FieldSpec(name, List.of(aliases), type, false);
    }

    /** Canonical name first, then aliases. */
    public List<String> candidateKeys() {
        List<String> keys = new ArrayList<>(aliases.size() + 1);
        keys.add(name);
        keys.addAll(aliases);
        return keys;
    }
}
