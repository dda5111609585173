package com.tokenmetadata.ingestion.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenmetadata.domain.ContentFingerprint;
import com.tokenmetadata.domain.FieldDefect;
import com.tokenmetadata.domain.NormalizedRecord;
import com.tokenmetadata.domain.RawPayload;
import com.tokenmetadata.domain.SchemaFamily;
import com.tokenmetadata.domain.Validity;
import com.tokenmetadata.ingestion.config.ValidationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses raw metadata bytes and checks them against a schema family. Never throws for bad content: parse
 * failures become INVALID records, field problems become defects on a PARTIALLY_VALID record. Deterministic
 * for a given (bytes, family).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetadataValidator {

    public static final String PARSE_ERROR = "PARSE_ERROR";
    static final String NOT_AN_OBJECT = "NOT_AN_OBJECT";

    private final ObjectMapper objectMapper;
    private final ValidationProperties validationProperties;

    public NormalizedRecord validate(RawPayload payload, SchemaFamily family) {
        ContentFingerprint fingerprint = payload.fingerprint();
        JsonNode root;
        try {
            root = objectMapper.readTree(payload.bytes());
        } catch (JsonProcessingException e) {
            log.debug("Unparseable metadata {} from {}: {}", fingerprint, payload.sourceUri(), e.getOriginalMessage());
            return NormalizedRecord.invalid(fingerprint, family, PARSE_ERROR);
        } catch (IOException e) {
            return NormalizedRecord.invalid(fingerprint, family, PARSE_ERROR);
        }
        if (root == null || root.isMissingNode()) {
            return NormalizedRecord.invalid(fingerprint, family, PARSE_ERROR);
        }
        if (!root.isObject()) {
            return NormalizedRecord.invalid(fingerprint, family, NOT_AN_OBJECT);
        }

        Set<String> consumed = new HashSet<>();
        String schemaVersion = NormalizedRecord.unversioned(family);
        JsonNode schemaNode = root.get(MetadataSchemas.SCHEMA_KEY);
        if (schemaNode != null && schemaNode.isTextual() && !schemaNode.asText().isBlank()) {
            schemaVersion = schemaNode.asText();
            consumed.add(MetadataSchemas.SCHEMA_KEY);
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        List<FieldDefect> defects = new ArrayList<>();
        for (FieldSpec spec : MetadataSchemas.fieldsOf(family)) {
            String key = firstPresentKey(root, spec);
            if (key == null) {
                if (spec.required()) {
                    defects.add(FieldDefect.missing(spec.name()));
                }
                continue;
            }
            consumed.add(key);
            FieldType.Conversion conversion = spec.type().convert(root.get(key), objectMapper);
            if (conversion.isMalformed()) {
                defects.add(FieldDefect.malformed(spec.name(), conversion.error()));
            } else {
                fields.put(spec.name(), conversion.value());
            }
        }

        Map<String, Object> extensions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!consumed.contains(entry.getKey())) {
                extensions.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), Object.class));
            }
        }

        switch (family) {
            case ITEM -> deriveItemArtifact(fields, defects);
            case PLACE -> derivePlaceGrid(fields);
            default -> {
            }
        }

        Validity validity = defects.isEmpty() ? Validity.VALID : Validity.PARTIALLY_VALID;
        return new NormalizedRecord(fingerprint, family, schemaVersion, fields, extensions, validity, null, defects);
    }

    private static String firstPresentKey(JsonNode root, FieldSpec spec) {
        for (String key : spec.candidateKeys()) {
            JsonNode node = root.get(key);
            if (node != null && !node.isNull()) {
                return key;
            }
        }
        return null;
    }

    /**
     * The format entry whose uri is the artifact describes it: mime type, file size and, for images,
     * pixel dimensions written {@code WxH}.
     */
    private void deriveItemArtifact(Map<String, Object> fields, List<FieldDefect> defects) {
        if (!(fields.get("artifactUri") instanceof String artifactUri) || !(fields.get("formats") instanceof List<?> formats)) {
            return;
        }
        Map<?, ?> format = null;
        for (Object candidate : formats) {
            if (candidate instanceof Map<?, ?> map && artifactUri.equals(map.get("uri"))) {
                format = map;
                break;
            }
        }
        if (format == null) {
            rejectFormats(fields, defects, "formats do not include artifactUri");
            return;
        }
        if (!(format.get("mimeType") instanceof String mimeType)) {
            rejectFormats(fields, defects, "artifact format lacks mimeType");
            return;
        }
        Object fileSize = format.get("fileSize");
        if (!(fileSize instanceof Integer || fileSize instanceof Long) || ((Number) fileSize).longValue() < 0) {
            rejectFormats(fields, defects, "artifact format lacks integer fileSize");
            return;
        }
        if (!validationProperties.getAllowedItemMimeTypes().contains(mimeType)) {
            rejectFormats(fields, defects, "unsupported mime type: " + mimeType);
            return;
        }

        Integer width = null;
        Integer height = null;
        Object dimensions = format.get("dimensions");
        if (dimensions != null) {
            int[] size = parsePixelDimensions(dimensions);
            if (size == null) {
                rejectFormats(fields, defects, "artifact dimensions must be {unit: px, value: WxH}");
                return;
            }
            width = size[0];
            height = size[1];
        }

        boolean image = validationProperties.getImageMimeTypes().contains(mimeType);
        if (image && width == null) {
            rejectFormats(fields, defects, "image artifact without pixel dimensions");
            return;
        }
        if (image && !fields.containsKey("imageFrame") && !hasDefect(defects, "imageFrame")) {
            defects.add(FieldDefect.missing("imageFrame"));
        }

        fields.put("artifactMimeType", mimeType);
        fields.put("artifactFileSize", ((Number) fileSize).longValue());
        if (width != null) {
            fields.put("width", width);
            fields.put("height", height);
        }
    }

    private static int[] parsePixelDimensions(Object dimensions) {
        if (!(dimensions instanceof Map<?, ?> map) || !"px".equals(map.get("unit"))
                || !(map.get("value") instanceof String value)) {
            return null;
        }
        String[] parts = value.split("x");
        if (parts.length != 2) {
            return null;
        }
        try {
            return new int[]{Integer.parseInt(parts[0].strip()), Integer.parseInt(parts[1].strip())};
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void rejectFormats(Map<String, Object> fields, List<FieldDefect> defects, String detail) {
        fields.remove("formats");
        defects.add(FieldDefect.malformed("formats", detail));
    }

    private static boolean hasDefect(List<FieldDefect> defects, String field) {
        return defects.stream().anyMatch(d -> d.field().equals(field));
    }

    private void derivePlaceGrid(Map<String, Object> fields) {
        if (!(fields.get("centerCoordinates") instanceof List<?> center) || center.size() != 3) {
            return;
        }
        double x = ((Number) center.get(0)).doubleValue();
        double y = ((Number) center.get(1)).doubleValue();
        double z = ((Number) center.get(2)).doubleValue();
        fields.put("gridHash", GridCellHasher.cellHash(x, y, z, validationProperties.getGridSize()));
    }
}
