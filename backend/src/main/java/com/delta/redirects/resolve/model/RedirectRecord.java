package com.delta.redirects.resolve.model;

public record RedirectRecord(String from, String to, double percent) {}
