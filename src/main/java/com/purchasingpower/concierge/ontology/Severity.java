package com.purchasingpower.concierge.ontology;

public enum Severity {
    HIGH,
    MEDIUM,
    LOW
}
