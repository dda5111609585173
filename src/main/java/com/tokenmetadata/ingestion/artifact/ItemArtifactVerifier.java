package com.tokenmetadata.ingestion.artifact;

import com.tokenmetadata.domain.FieldDefect;
import com.tokenmetadata.domain.NormalizedRecord;
import com.tokenmetadata.domain.RawPayload;
import com.tokenmetadata.domain.SchemaFamily;
import com.tokenmetadata.domain.Validity;
import com.tokenmetadata.ingestion.config.FetchProperties;
import com.tokenmetadata.ingestion.config.ValidationProperties;
import com.tokenmetadata.ingestion.fetch.FetchException;
import com.tokenmetadata.ingestion.fetch.MetadataFetcher;
import com.tokenmetadata.ingestion.fetch.MetadataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Downloads the artifact of a validated ITEM record and checks it against what the metadata declares:
 * the byte size must equal the artifact format's fileSize, and a glTF model may not render more polygons
 * than polygonCount beyond the configured tolerance. Mismatches become defects on a PARTIALLY_VALID record.
 *
 * <p>Download failures are not defects: the {@link FetchException} propagates so the event is retried or
 * quarantined like a failed metadata fetch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ItemArtifactVerifier {

    static final String COUNTED_POLYGONS = "countedPolygonCount";

    private final MetadataFetcher fetcher;
    private final FetchProperties fetchProperties;
    private final ValidationProperties validationProperties;

    public NormalizedRecord verify(NormalizedRecord record) {
        if (!validationProperties.isVerifyItemArtifacts()
                || record.schemaFamily() != SchemaFamily.ITEM
                || record.validity() == Validity.INVALID) {
            return record;
        }
        Map<String, Object> fields = new LinkedHashMap<>(record.fields());
        if (!(fields.get("artifactUri") instanceof String artifactUri)
                || !(fields.get("artifactFileSize") instanceof Long declaredSize)
                || !(fields.get("artifactMimeType") instanceof String mimeType)) {
            return record;
        }

        RawPayload artifact = download(artifactUri);
        List<FieldDefect> defects = new ArrayList<>(record.defects());

        if (artifact.size() != declaredSize) {
            fields.remove("formats");
            defects.add(FieldDefect.malformed("formats",
                    "artifact is " + artifact.size() + " bytes, formats declare " + declaredSize));
        }
        if (validationProperties.getGltfMimeTypes().contains(mimeType)) {
            checkPolygons(artifactUri, artifact, fields, defects);
        }

        if (defects.size() == record.defects().size() && fields.equals(record.fields())) {
            return record;
        }
        Validity validity = defects.isEmpty() ? Validity.VALID : Validity.PARTIALLY_VALID;
        return new NormalizedRecord(record.fingerprint(), record.schemaFamily(), record.schemaVersion(), fields,
                record.extensions(), validity, null, defects);
    }

    private RawPayload download(String artifactUri) {
        try {
            return fetcher.resolve(MetadataSource.uri(artifactUri), fetchProperties.getMaxArtifactBytes());
        } catch (FetchException e) {
            throw new FetchException(e.getKind(), "Artifact " + artifactUri + ": " + e.getMessage(), e);
        }
    }

    private void checkPolygons(String artifactUri, RawPayload artifact, Map<String, Object> fields,
                               List<FieldDefect> defects) {
        long counted;
        try {
            counted = GltfPolygonCounter.count(artifact.bytes());
        } catch (IOException e) {
            fields.remove("artifactUri");
            defects.add(FieldDefect.malformed("artifactUri", e.getMessage()));
            return;
        }
        fields.put(COUNTED_POLYGONS, counted);
        if (!(fields.get("polygonCount") instanceof Long declared)) {
            return;
        }
        long excess = Math.max(0, counted - declared);
        double allowed = declared * validationProperties.getPolygonCountToleranceBasisPoints() / 10_000.0;
        if (excess > allowed) {
            fields.remove("polygonCount");
            defects.add(FieldDefect.malformed("polygonCount",
                    "model has " + counted + " polygons, metadata declares " + declared));
        } else if (excess > 0) {
            log.warn("Polygon count of {} within tolerance: declared={}, counted={}", artifactUri, declared, counted);
        }
    }
}
