package com.purchasingpower.concierge.exception;

import lombok.Getter;

@Getter
public class FactStoreException extends RuntimeException {

    private final String namespace;

    public FactStoreException(String namespace, String message, Throwable cause) {
        super(message, cause);
        this.namespace = namespace;
    }
}
