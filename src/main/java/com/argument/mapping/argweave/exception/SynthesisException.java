package com.argument.mapping.argweave.exception;

/**
 * Raised when the claim synthesizer cannot produce a usable reply.
 */
public class SynthesisException extends RuntimeException {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
