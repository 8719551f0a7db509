package com.delta.redirects.resolve.model;

public record ProbeResult(Integer status, String finalUrl) {
    public static ProbeResult failed() {
        return new ProbeResult(null, null);
    }

    public boolean hasStatus() {
        return status != null;
    }

    public boolean redirected() {
        return finalUrl != null;
    }
}
