package com.tokenmetadata.domain;

/**
 * Outcome of validating a metadata document.
 */
public enum Validity {
    VALID,
    /** Parsed, but required fields are missing or typed fields are malformed. See defects. */
    PARTIALLY_VALID,
    /** Not usable at all (unparseable, not an object). See invalidReason. */
    INVALID
}
