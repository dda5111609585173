package com.tokenmetadata.ingestion.validation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Spatial bucket for places: SHA-1 hex of {@code "gx-gy-gz"} where each component is
 * {@code trunc(c / gridSize)} shifted one cell away from zero, so -50 and 50 never share a cell.
 */
public final class GridCellHasher {

    private GridCellHasher() {
    }

    public static long toGrid(double coordinate, double gridSize) {
        long sign = coordinate < 0 ? -1 : 1;
        return (long) (coordinate / gridSize) + sign;
    }

    public static String cellHash(double x, double y, double z, double gridSize) {
        if (!(gridSize > 0)) {
            throw new IllegalArgumentException("gridSize must be positive");
        }
        String cell = toGrid(x, gridSize) + "-" + toGrid(y, gridSize) + "-" + toGrid(z, gridSize);
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(sha1.digest(cell.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
