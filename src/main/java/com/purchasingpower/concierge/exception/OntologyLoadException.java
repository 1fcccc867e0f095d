package com.purchasingpower.concierge.exception;

import lombok.Getter;

@Getter
public class OntologyLoadException extends RuntimeException {

    private final String location;

    public OntologyLoadException(String location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }
}
