package com.formulagrid.app.exceptions;

/**
 * Thrown when a cell is given a value that is neither an integer
 * nor formula text (e.g. a Double or a Boolean).
 */
public class InvalidTypeException extends SheetException {

    public InvalidTypeException(String message) {
        super(ErrorCode.INVALID_TYPE, message);
    }
}
