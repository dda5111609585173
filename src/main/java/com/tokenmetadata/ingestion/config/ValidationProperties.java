package com.tokenmetadata.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Validator settings for families with derived fields and item artifact checks.
 */
@ConfigurationProperties(prefix = "tokenmetadata.validation")
@NoArgsConstructor
@Getter
@Setter
public class ValidationProperties {

    /** Cell size used to derive a place's gridHash from its center coordinates. */
    private double gridSize = 100.0;

    /** Artifact mime types accepted for ITEM metadata. */
    private List<String> allowedItemMimeTypes = new ArrayList<>(List.of(
            "model/gltf-binary", "model/gltf+json", "image/png", "image/jpeg"));

    /** Subset of allowedItemMimeTypes that require pixel dimensions. */
    private List<String> imageMimeTypes = new ArrayList<>(List.of("image/png", "image/jpeg"));

    /** Subset of allowedItemMimeTypes whose polygons are counted and compared with polygonCount. */
    private List<String> gltfMimeTypes = new ArrayList<>(List.of("model/gltf-binary", "model/gltf+json"));

    /** Download item artifacts and check them against the declared fileSize and polygonCount. */
    private boolean verifyItemArtifacts = true;

    /**
     * How many polygons a model may exceed its declared polygonCount by, in hundredths of a percent of
     * polygonCount. Fewer polygons than declared are always accepted.
     */
    private int polygonCountToleranceBasisPoints = 100;
}
