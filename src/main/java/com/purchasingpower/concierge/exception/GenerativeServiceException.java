package com.purchasingpower.concierge.exception;

import lombok.Getter;

@Getter
public class GenerativeServiceException extends RuntimeException {

    private final String caller;

    public GenerativeServiceException(String caller, String message, Throwable cause) {
        super(message, cause);
        this.caller = caller;
    }
}
