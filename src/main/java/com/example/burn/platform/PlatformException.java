package com.example.burn.platform;

/**
 * A single platform call failed. Callers treat it as transient and isolated to that call.
 */
public class PlatformException extends RuntimeException {

    public PlatformException(String message) {
        super(message);
    }

    public PlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
