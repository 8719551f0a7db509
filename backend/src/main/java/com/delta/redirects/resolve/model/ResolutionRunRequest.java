package com.delta.redirects.resolve.model;

public record ResolutionRunRequest(
    String errorsFile,
    String productsFile,
    String catalogFile,
    Boolean resetStore,
    Boolean skipStatusCheck
) {
    public static ResolutionRunRequest defaults() {
        return new ResolutionRunRequest(null, null, null, null, null);
    }
}
