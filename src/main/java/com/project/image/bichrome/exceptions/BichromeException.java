package com.project.image.bichrome.exceptions;

/** Domain-specific exception for processing errors. */
public abstract class BichromeException extends RuntimeException {
    protected BichromeException(String message) { super(message); }
    protected BichromeException(String message, Throwable cause) { super(message, cause); }

    public abstract ErrorKind kind();
}
