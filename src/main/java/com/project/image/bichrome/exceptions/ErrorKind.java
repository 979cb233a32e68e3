package com.project.image.bichrome.exceptions;

/** Category reported for every failed image so an operator can decide what to retry. */
public enum ErrorKind {
    DECODE,
    INVALID_DIMENSIONS,
    ENCODE,
    STORAGE
}
