package com.tokenmetadata.ingestion.validation;

import com.tokenmetadata.domain.SchemaFamily;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.tokenmetadata.ingestion.validation.FieldSpec.optional;
import static com.tokenmetadata.ingestion.validation.FieldSpec.required;

/**
 * Field declarations per schema family. Aliases cover the drift seen across token standards
 * ({@code image} vs {@code displayUri}, {@code animation_url} vs {@code artifactUri}).
 */
public final class MetadataSchemas {

    public static final String SCHEMA_KEY = "$schema";

    private static final Map<SchemaFamily, List<FieldSpec>> FIELDS = new EnumMap<>(SchemaFamily.class);

    static {
        FIELDS.put(SchemaFamily.GENERIC, List.of(
                required("name", FieldType.STRING),
                optional("description", FieldType.TEXT),
                optional("displayUri", FieldType.URI, "image", "display_uri"),
                optional("tags", FieldType.TAGS)));

        FIELDS.put(SchemaFamily.FUNGIBLE, List.of(
                required("name", FieldType.STRING),
                required("symbol", FieldType.STRING),
                required("decimals", FieldType.DECIMALS),
                optional("description", FieldType.TEXT),
                optional("thumbnailUri", FieldType.URI, "thumbnail_uri", "icon"),
                optional("displayUri", FieldType.URI, "image", "display_uri")));

        FIELDS.put(SchemaFamily.COLLECTIBLE, List.of(
                required("name", FieldType.STRING),
                required("artifactUri", FieldType.URI, "animation_url", "artifact_uri"),
                optional("description", FieldType.TEXT),
                optional("displayUri", FieldType.URI, "image", "display_uri"),
                optional("thumbnailUri", FieldType.URI, "thumbnail_uri"),
                optional("tags", FieldType.TAGS),
                optional("attributes", FieldType.ARRAY),
                optional("formats", FieldType.ARRAY)));

        FIELDS.put(SchemaFamily.ITEM, List.of(
                required("polygonCount", FieldType.NON_NEGATIVE_INTEGER),
                required("baseScale", FieldType.NUMBER),
                required("artifactUri", FieldType.URI, "animation_url", "artifact_uri"),
                required("formats", FieldType.ARRAY),
                required("tags", FieldType.TAGS),
                optional("name", FieldType.STRING),
                optional("description", FieldType.TEXT),
                optional("thumbnailUri", FieldType.URI, "thumbnail_uri"),
                optional("displayUri", FieldType.URI, "image", "display_uri"),
                optional("imageFrame", FieldType.OBJECT)));

        FIELDS.put(SchemaFamily.PLACE, List.of(
                required("placeType", FieldType.STRING),
                required("borderCoordinates", FieldType.COORDINATE_LIST),
                required("centerCoordinates", FieldType.COORDINATES_3),
                required("buildHeight", FieldType.NUMBER),
                optional("name", FieldType.TEXT),
                optional("description", FieldType.TEXT)));

        FIELDS.put(SchemaFamily.CONTRACT, List.of(
                required("name", FieldType.STRING),
                required("description", FieldType.TEXT),
                optional("userDescription", FieldType.TEXT),
                optional("tags", FieldType.TAGS)));
    }

    private MetadataSchemas() {
    }

    public static List<FieldSpec> fieldsOf(SchemaFamily family) {
        return FIELDS.get(family);
    }
}
