package com.satfetch.models;

import java.time.Instant;

public record ProductInfo(
        String instrument,
        String level,
        String productType,
        Instant acquisitionTime
) {
}
