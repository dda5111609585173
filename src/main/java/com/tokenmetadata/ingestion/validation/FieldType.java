package com.tokenmetadata.ingestion.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Expected type of a canonical field, with the conversion from a parsed JSON node. Conversions accept the
 * common producer variants (numeric strings for integers, a comma string for tag lists).
 */
public enum FieldType {

    STRING {
        @Override
        Conversion convert(JsonNode node, ObjectMapper mapper) {
            if (!node.isTextual() || node.asText().isBlank()) {
                return Conversion.malformed("expected non-empty string");
            }
            return Conversion.of(node.asText());
        }
    },

    /** Free text that may be empty. */
    TEXT {
        @Override
        Conversion convert(JsonNode node, ObjectMapper mapper) {
            if (!node.isTextual()) {
                return Conversion.malformed("expected string");
            }
            return Conversion.of(node.asText());
        }
    },

    URI {
        @Override
        Conversion convert(JsonNode node, ObjectMapper mapper) {
            if (!node.isTextual() || node.asText().isBlank()) {
                return Conversion.malformed("expected URI string");
            }
            String value = node.asText().strip();
            int colon = value.indexOf(':');
            if (colon <= 0) {
                return Conversion.malformed("URI without scheme");
            }
            return Conversion.of(value);
        }
    },

    NON_NEGATIVE_INTEGER {
        @Override
        Conversion convert(JsonNode node, ObjectMapper mapper) {
            Long value = integralValue(node);
            if (value == null || value < 0) {
                return Conversion.malformed("expected non-negative integer");
            }
            return Conversion.of(value);
        }
    },

    /** Fungible token decimals: integer 0..255. */
    DECIMALS {
        @Override
        Conversion convert(JsonNode node, ObjectMapper mapper) {
            Long value = integralValue(node);
            if (value == null || value < 0 || value > 255) {
                return Conversion.malformed("expected integer decimals in 0..255");
            }
            return Conversion.of(value.intValue());
        }
    },

    NUMBER {
        @Override
        Conversion convert(JsonNode node, ObjectMapper mapper) {
            if (node.isNumber()) {
                return Conversion.of(node.numberValue());
            }
            if (node.isTextual()) {
                try {
                    return Conversion.of(Double.parseDouble(node.asText().strip()));
                } catch (NumberFormatException e) {
                    return Conversion.malformed("expected number");
                }
            }
            return Conversion.malformed("expected number");
        }
    },

    /** Tags: array of strings, or one comma-separated string. Normalized by {@link TagNormalizer}. */
    TAGS {
        @Override
        Conversion convert(JsonNode node, ObjectMapper mapper) {
            List<String> raw = new ArrayList<>();
            if (node.isTextual()) {
                raw.add(node.asText());
            } else if (node.isArray()) {
                for (JsonNode element : node) {
                    if (!element.isTextual()) {
                        return Conversion.malformed("expected array of strings");
                    }
                    raw.add(element.asText());
                }
            } else {
                return Conversion.malformed("expected array of strings");
            }
            return Conversion.of(TagNormalizer.normalize(raw));
        }
    },

    /** Exactly three numbers: x, y, z. */
    COORDINATES_3 {
        @Override
        Conversion convert(JsonNode node, ObjectMapper mapper) {
            if (!node.isArray() || node.size() != 3) {
                return Conversion.malformed("expected array of 3 numbers");
            }
            List<Number> values = new ArrayList<>(3);
            for (JsonNode element : node) {
                if (!element.isNumber()) {
                    return Conversion.malformed("expected array of 3 numbers");
                }
                values.add(element.numberValue());
            }
            return Conversion.of(values);
        }
    },

    /** Array of number arrays (polygon outline). */
    COORDINATE_LIST {
        @Override
        Conversion convert(JsonNode node, ObjectMapper mapper) {
            if (!node.isArray() || node.isEmpty()) {
                return Conversion.malformed("expected non-empty array of coordinates");
            }
            for (JsonNode point : node) {
                if (!point.isArray() || point.isEmpty()) {
                    return Conversion.malformed("expected non-empty array of coordinates");
                }
                for (JsonNode component : point) {
                    if (!component.isNumber()) {
                        return Conversion.malformed("coordinate components must be numbers");
                    }
                }
            }
            return Conversion.of(mapper.convertValue(node, Object.class));
        }
    },

    ARRAY {
        @Override
        Conversion convert(JsonNode node, ObjectMapper mapper) {
            return node.isArray() ? Conversion.of(mapper.convertValue(node, Object.class))
                    : Conversion.malformed("expected array");
        }
    },

    OBJECT {
        @Override
        Conversion convert(JsonNode node, ObjectMapper mapper) {
            return node.isObject() ? Conversion.of(mapper.convertValue(node, Object.class))
                    : Conversion.malformed("expected object");
        }
    };

    abstract Conversion convert(JsonNode node, ObjectMapper mapper);

    private static Long integralValue(JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isFloatingPointNumber()) {
            double d = node.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.007199254740992E15) {
                return (long) d;
            }
            return null;
        }
        if (node.isTextual()) {
            String text = node.asText().strip();
            if (text.matches("-?\\d{1,18}")) {
                return Long.parseLong(text);
            }
        }
        return null;
    }

    /**
     * Either a converted value or the reason the node did not fit.
     */
    record Conversion(Object value, String error) {

        static Conversion of(Object value) {
            return new Conversion(value, null);
        }

        static Conversion malformed(String error) {
            return new Conversion(null, error);
        }

        boolean isMalformed() {
            return error != null;
        }
    }
}
