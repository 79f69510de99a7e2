package com.locus.sandbox;

/**
 * A sandbox could not be created, reached or provisioned.
 */
public class SandboxException extends RuntimeException {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
