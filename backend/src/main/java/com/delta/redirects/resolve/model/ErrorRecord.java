package com.delta.redirects.resolve.model;

public record ErrorRecord(String url, Integer status, String finalUrl) {}
