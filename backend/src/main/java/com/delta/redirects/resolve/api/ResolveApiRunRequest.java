package com.delta.redirects.resolve.api;

public record ResolveApiRunRequest(
    String errorsFile,
    String productsFile,
    String catalogFile,
    Boolean resetStore,
    Boolean skipStatusCheck
) {
}
