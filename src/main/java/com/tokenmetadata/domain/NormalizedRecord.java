package com.tokenmetadata.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validated, normalized metadata body. Token-independent: one record can back many tokens that reference
 * byte-identical content; token identity is attached when persisting.
 *
 * @param fingerprint   digest of the raw bytes the record was built from
 * @param schemaFamily  family the document was validated against
 * @param schemaVersion the document's {@code $schema}, or {@code <family>/unversioned}
 * @param fields        canonical fields that passed type checks, in family declaration order, then derived ones
 * @param extensions    keys not known to the family, kept verbatim
 * @param validity      overall outcome
 * @param invalidReason set only for {@link Validity#INVALID}
 * @param defects       field problems; empty for VALID
 */
public record NormalizedRecord(
        ContentFingerprint fingerprint,
        SchemaFamily schemaFamily,
        String schemaVersion,
        Map<String, Object> fields,
        Map<String, Object> extensions,
        Validity validity,
        String invalidReason,
        List<FieldDefect> defects
) {

    public NormalizedRecord {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(schemaFamily, "schemaFamily");
        Objects.requireNonNull(validity, "validity");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields != null ? fields : Map.of()));
        extensions = Collections.unmodifiableMap(new LinkedHashMap<>(extensions != null ? extensions : Map.of()));
        defects = defects != null ? List.copyOf(defects) : List.of();
    }

    public static NormalizedRecord invalid(ContentFingerprint fingerprint, SchemaFamily family, String reason) {
        return new NormalizedRecord(fingerprint, family, unversioned(family), Map.of(), Map.of(),
                Validity.INVALID, reason, List.of());
    }

    public static String unversioned(SchemaFamily family) {
        return family.name().toLowerCase() + "/unversioned";
    }

    public List<String> missingFields() {
        return defects.stream()
                .filter(d -> d.kind() == FieldDefect.Kind.MISSING)
                .map(FieldDefect::field)
                .toList();
    }
}
