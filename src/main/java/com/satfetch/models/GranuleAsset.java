package com.satfetch.models;

public record GranuleAsset(
        String href,
        String mediaType
) {
}
