package com.tokenmetadata.ingestion.artifact;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GltfPolygonCounterTest {

    static byte[] fixture(String name) throws IOException {
        try (InputStream in = GltfPolygonCounterTest.class.getResourceAsStream("/gltf/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return in.readAllBytes();
        }
    }

    @Test
    void countsChildNodes() throws IOException {
        assertThat(GltfPolygonCounter.count(fixture("two-quads.gltf"))).isEqualTo(4);
    }

    @Test
    void trianglesStripsAndFans_counted_linesAndUnindexedIgnored() throws IOException {
        // 6 indices: 2 triangles, strip 4, fan 4, lines 0, unindexed 0
        assertThat(GltfPolygonCounter.count(fixture("mixed-modes.gltf"))).isEqualTo(10);
    }

    @Test
    void notAModel_rejected() {
        byte[] png = "\u0089PNG not a model".getBytes(StandardCharsets.ISO_8859_1);

        assertThatThrownBy(() -> GltfPolygonCounter.count(png)).isInstanceOf(IOException.class);
    }
}
