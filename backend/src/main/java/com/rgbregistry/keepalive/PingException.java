package com.rgbregistry.keepalive;

/**
 * Thrown when a keepalive ping fails (HTTP error, connection failure, timeout).
 */
public class PingException extends RuntimeException {

    public PingException(String message, Throwable cause) {
        super(message, cause);
    }
}
