package com.delta.redirects.resolve.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveResolutionRunException extends RuntimeException {
    public ActiveResolutionRunException(String message) {
        super(message);
    }
}
