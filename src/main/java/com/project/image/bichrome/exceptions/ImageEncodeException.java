package com.project.image.bichrome.exceptions;

/** Destination is unwritable or no writer exists for the requested format. */
public class ImageEncodeException extends BichromeException {
    public ImageEncodeException(String message) { super(message); }
    public ImageEncodeException(String message, Throwable cause) { super(message, cause); }

    @Override
    public ErrorKind kind() { return ErrorKind.ENCODE; }
}
