package com.formulagrid.app.exceptions;

/**
 * Base class for every failure raised by a sheet operation.
 * None of them is fatal: the sheet stays usable after any of these is thrown.
 */
public abstract class SheetException extends RuntimeException {

    private final ErrorCode code;

    protected SheetException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected SheetException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
