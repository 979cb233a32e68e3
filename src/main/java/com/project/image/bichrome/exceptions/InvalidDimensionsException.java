package com.project.image.bichrome.exceptions;

public class InvalidDimensionsException extends BichromeException {
    public InvalidDimensionsException(String message) { super(message); }

    @Override
    public ErrorKind kind() { return ErrorKind.INVALID_DIMENSIONS; }
}
