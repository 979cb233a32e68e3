package com.project.image.bichrome.exceptions;

public class StorageException extends BichromeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }

    @Override
    public ErrorKind kind() { return ErrorKind.STORAGE; }
}
