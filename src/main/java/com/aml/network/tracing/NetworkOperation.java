package com.aml.network.tracing;

/**
 * Traced units of work. Each maps to a fixed span name.
 */
public enum NetworkOperation {
    ANALYZE("network.analyze"),
    BUILD("network.build"),
    PATH("network.path");

    private final String spanName;

    NetworkOperation(String spanName) {
        this.spanName = spanName;
    }

    public String spanName() {
        return spanName;
    }
}
