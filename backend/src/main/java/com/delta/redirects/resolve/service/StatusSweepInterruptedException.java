package com.delta.redirects.resolve.service;

public class StatusSweepInterruptedException extends RuntimeException {
    public StatusSweepInterruptedException(String message) {
        super(message);
    }
}
