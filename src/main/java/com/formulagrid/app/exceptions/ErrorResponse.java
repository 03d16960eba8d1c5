package com.formulagrid.app.exceptions;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Simple DTO to structure error responses with a code and message.
 * For example:
 * {
 *   "code": "CIRCULAR_REFERENCE",
 *   "message": "Circular reference detected at A1 while setting A2",
 *   "location": "A1"
 * }
 * The location is omitted when the failure has no single cell or position to point at.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String code;
    private final String message;
    private final String location;

    public ErrorResponse(String code, String message) {
        this(code, message, null);
    }

    public ErrorResponse(String code, String message, String location) {
        this.code = code;
        this.message = message;
        this.location = location;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getLocation() {
        return location;
    }
}
