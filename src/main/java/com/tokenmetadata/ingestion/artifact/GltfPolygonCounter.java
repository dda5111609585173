package com.tokenmetadata.ingestion.artifact;

import de.javagl.jgltf.model.AccessorModel;
import de.javagl.jgltf.model.GltfConstants;
import de.javagl.jgltf.model.GltfModel;
import de.javagl.jgltf.model.MeshModel;
import de.javagl.jgltf.model.MeshPrimitiveModel;
import de.javagl.jgltf.model.NodeModel;
import de.javagl.jgltf.model.SceneModel;
import de.javagl.jgltf.model.io.GltfModelReader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;

/**
 * Counts the triangles a glTF model renders: every node reachable from the first scene, every indexed
 * primitive of its meshes. Accepts both the JSON and the binary (.glb) container. External buffers are not
 * loaded; only accessor counts are read.
 */
final class GltfPolygonCounter {

    private GltfPolygonCounter() {
    }

    /**
     * @throws IOException when the bytes are not a readable glTF model or it has no scene
     */
    static long count(byte[] artifact) throws IOException {
        GltfModel model;
        try {
            model = new GltfModelReader().readWithoutReferences(new ByteArrayInputStream(artifact));
        } catch (RuntimeException e) {
            throw new IOException("unreadable glTF: " + e.getMessage(), e);
        }
        List<SceneModel> scenes = model.getSceneModels();
        if (scenes == null || scenes.isEmpty()) {
            throw new IOException("glTF has no scene");
        }
        long total = 0;
        for (NodeModel node : scenes.get(0).getNodeModels()) {
            total += countNode(node);
        }
        return total;
    }

    private static long countNode(NodeModel node) {
        long count = 0;
        for (MeshModel mesh : node.getMeshModels()) {
            for (MeshPrimitiveModel primitive : mesh.getMeshPrimitiveModels()) {
                count += countPrimitive(primitive);
            }
        }
        for (NodeModel child : node.getChildren()) {
            count += countNode(child);
        }
        return count;
    }

    private static long countPrimitive(MeshPrimitiveModel primitive) {
        AccessorModel indices = primitive.getIndices();
        if (indices == null) {
            return 0;
        }
        int vertices = indices.getCount();
        switch (primitive.getMode()) {
            case GltfConstants.GL_TRIANGLES:
                return vertices / 3;
            case GltfConstants.GL_TRIANGLE_STRIP:
            case GltfConstants.GL_TRIANGLE_FAN:
                return Math.max(0, vertices - 2);
            default:
                return 0;
        }
    }
}
