package com.tokenmetadata.ingestion.validation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tags arrive as {@code ["Art, 3D", "art"]} as often as {@code ["art", "3d"]}: every entry is split on commas,
 * trimmed and lowercased; empties and repeats are dropped, first occurrence wins.
 */
public final class TagNormalizer {

    private TagNormalizer() {
    }

    public static List<String> normalize(List<String> rawTags) {
        if (rawTags == null || rawTags.isEmpty()) {
            return List.of();
        }
        Set<String> tags = new LinkedHashSet<>();
        for (String tag : rawTags) {
            if (tag == null) {
                continue;
            }
            for (String split : tag.split(",")) {
                String stripped = split.strip();
                if (!stripped.isEmpty()) {
                    tags.add(stripped.toLowerCase(Locale.ROOT));
                }
            }
        }
        return new ArrayList<>(tags);
    }
}
