package com.delta.redirects.resolve.model;

public record ReferenceCode(String code) {}
