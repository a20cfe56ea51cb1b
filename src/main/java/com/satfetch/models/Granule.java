package com.satfetch.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Granule(
        String granuleId,
        String source,
        Map<String, GranuleAsset> assets,
        ProductInfo info
) {
    public static final String METADATA_FILE = "_granule.json";

    public Granule {
        if (granuleId == null || granuleId.isBlank()) {
            throw new IllegalArgumentException("Granule id must be set");
        }
        assets = assets == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(assets));
    }
}
