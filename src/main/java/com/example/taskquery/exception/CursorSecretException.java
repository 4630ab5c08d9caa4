package com.example.taskquery.exception;

/**
 * Exception for a cursor signing secret that must not be used in the current environment.
 * Raised while the application context starts, which aborts startup.
 */
public class CursorSecretException extends IllegalStateException {

    public CursorSecretException(String message) {
        super(message);
    }
}
