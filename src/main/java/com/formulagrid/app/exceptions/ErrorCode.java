package com.formulagrid.app.exceptions;

/**
 * Machine-readable kinds of failure a sheet operation can report.
 * The name is used verbatim as the "code" of an {@link ErrorResponse}.
 */
public enum ErrorCode {
    INVALID_ADDRESS,
    PARSE_ERROR,
    INVALID_TYPE,
    CIRCULAR_REFERENCE
}
