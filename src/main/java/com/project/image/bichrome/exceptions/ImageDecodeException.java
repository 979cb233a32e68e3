package com.project.image.bichrome.exceptions;

/** Source image is unreadable, corrupt or in a format no reader supports. */
public class ImageDecodeException extends BichromeException {
    public ImageDecodeException(String message) { super(message); }
    public ImageDecodeException(String message, Throwable cause) { super(message, cause); }

    @Override
    public ErrorKind kind() { return ErrorKind.DECODE; }
}
