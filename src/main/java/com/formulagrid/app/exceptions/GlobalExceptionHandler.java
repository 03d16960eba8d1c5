package com.formulagrid.app.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches sheet exceptions from anywhere in the controllers or services,
 * returning error JSON with an HTTP 400 instead of 500.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CircularReferenceException.class)
    public ResponseEntity<ErrorResponse> handleCircularRef(CircularReferenceException ex) {
        ErrorResponse error = new ErrorResponse(ex.getCode().name(), ex.getMessage(),
                String.valueOf(ex.getCycleCell()));
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ExpressionParseException.class)
    public ResponseEntity<ErrorResponse> handleParseError(ExpressionParseException ex) {
        String location = ex.getPosition() < 0 ? null : String.valueOf(ex.getPosition());
        ErrorResponse error = new ErrorResponse(ex.getCode().name(), ex.getMessage(), location);
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(AddressParseException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAddress(AddressParseException ex) {
        ErrorResponse error = new ErrorResponse(ex.getCode().name(), ex.getMessage(), ex.getAddress());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SheetException.class)
    public ResponseEntity<ErrorResponse> handleSheetException(SheetException ex) {
        ErrorResponse error = new ErrorResponse(ex.getCode().name(), ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        ErrorResponse error = new ErrorResponse("BAD_REQUEST", "Request body is missing or unreadable");
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        // Catch-all for runtime exceptions that are not sheet failures
        logger.error("Unexpected failure while serving request", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
