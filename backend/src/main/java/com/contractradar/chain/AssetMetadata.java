package com.contractradar.chain;

/**
 * Display metadata from the DAS {@code getAsset} method.
 */
public record AssetMetadata(String name, String symbol, String imageUrl) {

    public static final String UNKNOWN_NAME = "Unknown";
    public static final String UNKNOWN_SYMBOL = "UNKNOWN";
}
