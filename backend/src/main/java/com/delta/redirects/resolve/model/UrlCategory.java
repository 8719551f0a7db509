package com.delta.redirects.resolve.model;

import java.util.Locale;

public enum UrlCategory {
    PRODUCT("/product/", "product_codes"),
    CATALOG("/catalog/", "catalog_codes");

    private final String pathMarker;
    private final String tableName;

    UrlCategory(String pathMarker, String tableName) {
        this.pathMarker = pathMarker;
        this.tableName = tableName;
    }

    public String pathMarker() {
        return pathMarker;
    }

    public String tableName() {
        return tableName;
    }

    public String pathSegment() {
        return name().toLowerCase(Locale.ROOT);
    }
}
