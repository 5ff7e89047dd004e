package com.codeforge.orchestrator.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/** Rejected submission or query: bad agent type, oversized input, bad page. */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidJobRequestException extends RuntimeException {

    public InvalidJobRequestException(String message) {
        super(message);
    }

    public InvalidJobRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
