package com.eventseries.service.core.keys;

public class UnsupportedKeyShapeException extends IllegalArgumentException {

    public UnsupportedKeyShapeException(String message) {
        super(message);
    }

    public static UnsupportedKeyShapeException of(Object keys) {
        String type = keys == null ? "null" : keys.getClass().getName();
        return new UnsupportedKeyShapeException("Unsupported key type: " + type);
    }
}
