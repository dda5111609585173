package com.tokenmetadata.ingestion.artifact;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenmetadata.domain.FieldDefect;
import com.tokenmetadata.domain.NormalizedRecord;
import com.tokenmetadata.domain.RawPayload;
import com.tokenmetadata.domain.SchemaFamily;
import com.tokenmetadata.domain.Validity;
import com.tokenmetadata.ingestion.config.FetchProperties;
import com.tokenmetadata.ingestion.config.ValidationProperties;
import com.tokenmetadata.ingestion.fetch.FetchErrorKind;
import com.tokenmetadata.ingestion.fetch.FetchException;
import com.tokenmetadata.ingestion.fetch.MetadataFetcher;
import com.tokenmetadata.ingestion.fetch.MetadataSource;
import com.tokenmetadata.ingestion.validation.MetadataValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ItemArtifactVerifierTest {

    private static final String ARTIFACT = "ipfs://QmModel/model.gltf";

    private MetadataFetcher fetcher;
    private FetchProperties fetchProperties;
    private ValidationProperties validationProperties;
    private MetadataValidator validator;
    private ItemArtifactVerifier verifier;
    private byte[] model;

    @BeforeEach
    void setUp() throws IOException {
        fetcher = mock(MetadataFetcher.class);
        fetchProperties = new FetchProperties();
        fetchProperties.setMaxArtifactBytes(4096);
        validationProperties = new ValidationProperties();
        validator = new MetadataValidator(new ObjectMapper(), validationProperties);
        verifier = new ItemArtifactVerifier(fetcher, fetchProperties, validationProperties);
        model = GltfPolygonCounterTest.fixture("two-quads.gltf");
    }

    private NormalizedRecord item(long polygonCount, long fileSize, String mimeType) {
        String json = """
                {"polygonCount":%d,"baseScale":1,"artifactUri":"%s","tags":["chair"],
                 "formats":[{"uri":"%s","mimeType":"%s","fileSize":%d,
                             "dimensions":{"unit":"px","value":"64x64"}}],
                 "imageFrame":{}}
                """.formatted(polygonCount, ARTIFACT, ARTIFACT, mimeType, fileSize);
        return validator.validate(RawPayload.inline(json.getBytes(StandardCharsets.UTF_8)), SchemaFamily.ITEM);
    }

    private void artifactIs(byte[] bytes) {
        when(fetcher.resolve(any(MetadataSource.class), anyLong()))
                .thenReturn(new RawPayload(bytes, ARTIFACT, Instant.now(), "https://a"));
    }

    @Test
    void matchingModel_staysValid_withCountedPolygons() {
        artifactIs(model);

        NormalizedRecord verified = verifier.verify(item(4, model.length, "model/gltf+json"));

        assertThat(verified.validity()).isEqualTo(Validity.VALID);
        assertThat(verified.fields())
                .containsEntry("polygonCount", 4L)
                .containsEntry(ItemArtifactVerifier.COUNTED_POLYGONS, 4L);
        ArgumentCaptor<MetadataSource> source = ArgumentCaptor.forClass(MetadataSource.class);
        verify(fetcher).resolve(source.capture(), eq(4096L));
        assertThat(source.getValue().getUri()).isEqualTo(ARTIFACT);
    }

    @Test
    void sizeMismatch_formatsMalformed() {
        artifactIs(model);

        NormalizedRecord verified = verifier.verify(item(4, model.length + 1L, "model/gltf+json"));

        assertThat(verified.validity()).isEqualTo(Validity.PARTIALLY_VALID);
        assertThat(verified.fields()).doesNotContainKey("formats");
        assertThat(verified.defects()).singleElement().satisfies(d -> {
            assertThat(d.field()).isEqualTo("formats");
            assertThat(d.kind()).isEqualTo(FieldDefect.Kind.MALFORMED);
            assertThat(d.detail()).contains(String.valueOf(model.length));
        });
    }

    @Test
    @DisplayName("declared 3 polygons, model has 4: over the 1% tolerance")
    void morePolygonsThanDeclared_polygonCountMalformed() {
        artifactIs(model);

        NormalizedRecord verified = verifier.verify(item(3, model.length, "model/gltf+json"));

        assertThat(verified.validity()).isEqualTo(Validity.PARTIALLY_VALID);
        assertThat(verified.fields()).doesNotContainKey("polygonCount");
        assertThat(verified.defects()).extracting(FieldDefect::field).containsExactly("polygonCount");
    }

    @Test
    void excessWithinTolerance_accepted() {
        validationProperties.setPolygonCountToleranceBasisPoints(5_000);
        artifactIs(model);

        NormalizedRecord verified = verifier.verify(item(3, model.length, "model/gltf+json"));

        assertThat(verified.validity()).isEqualTo(Validity.VALID);
    }

    @Test
    void fewerPolygonsThanDeclared_accepted() {
        artifactIs(model);

        assertThat(verifier.verify(item(500, model.length, "model/gltf+json")).validity()).isEqualTo(Validity.VALID);
    }

    @Test
    void unreadableModel_artifactMalformed() {
        byte[] junk = "not a model".getBytes(StandardCharsets.UTF_8);
        artifactIs(junk);

        NormalizedRecord verified = verifier.verify(item(4, junk.length, "model/gltf-binary"));

        assertThat(verified.validity()).isEqualTo(Validity.PARTIALLY_VALID);
        assertThat(verified.defects()).extracting(FieldDefect::field).containsExactly("artifactUri");
    }

    @Test
    void imageArtifact_sizeCheckedOnly() {
        byte[] png = new byte[300];
        artifactIs(png);

        NormalizedRecord verified = verifier.verify(item(0, 300, "image/png"));

        assertThat(verified.validity()).isEqualTo(Validity.VALID);
        assertThat(verified.fields()).doesNotContainKey(ItemArtifactVerifier.COUNTED_POLYGONS);
    }

    @Test
    void downloadFailure_propagatesWithKind() {
        when(fetcher.resolve(any(MetadataSource.class), anyLong()))
                .thenThrow(new FetchException(FetchErrorKind.TOO_LARGE, "over 4096 bytes"));

        assertThatThrownBy(() -> verifier.verify(item(4, 10, "model/gltf-binary")))
                .isInstanceOfSatisfying(FetchException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(FetchErrorKind.TOO_LARGE);
                    assertThat(e.getMessage()).contains(ARTIFACT);
                });
    }

    @Test
    void otherFamilies_andDisabledCheck_noDownload() {
        NormalizedRecord generic = validator.validate(
                RawPayload.inline("{\"name\":\"x\"}".getBytes(StandardCharsets.UTF_8)), SchemaFamily.GENERIC);
        assertThat(verifier.verify(generic)).isSameAs(generic);

        validationProperties.setVerifyItemArtifacts(false);
        NormalizedRecord item = item(4, 10, "model/gltf-binary");
        assertThat(verifier.verify(item)).isSameAs(item);

        verify(fetcher, never()).resolve(any(MetadataSource.class), anyLong());
    }
}
