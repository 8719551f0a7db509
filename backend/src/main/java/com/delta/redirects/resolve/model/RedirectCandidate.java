package com.delta.redirects.resolve.model;

public record RedirectCandidate(String code, double percent) {}
