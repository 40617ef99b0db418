package com.example.pets.biz.commons.exceptions;

import com.example.pets.biz.commons.dto.ErrorResponse;
import com.example.pets.biz.commons.dto.ValidationErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ProductValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ValidationErrorResponse handleValidation(ProductValidationException ex) {
        log.info("GlobalExceptionHandler::handleValidation - {}", ex.getErrors());
        return new ValidationErrorResponse(HttpStatus.BAD_REQUEST.value(), ex.getErrors());
    }

    @ExceptionHandler(ProductIdMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleIdMismatch(ProductIdMismatchException ex) {
        log.info("GlobalExceptionHandler::handleIdMismatch - path id: {} body id: {}", ex.getPathId(), ex.getBodyId());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleUnreadable(Exception ex) {
        log.info("GlobalExceptionHandler::handleUnreadable - {}", ex.getMessage());
        return badRequest("Malformed request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        // framework errors such as unknown routes or unsupported methods keep their own status
        if (ex instanceof org.springframework.web.ErrorResponse frameworkError) {
            var status = frameworkError.getStatusCode();
            log.info("GlobalExceptionHandler::handleGeneric - {} {}", status.value(), ex.getMessage());
            var reason = HttpStatus.resolve(status.value());
            var body = new ErrorResponse(status.value(), reason != null ? reason.getReasonPhrase() : "Error", ex.getMessage());
            return ResponseEntity.status(status).headers(frameworkError.getHeaders()).body(body);
        }
        log.error("GlobalExceptionHandler::handleGeneric - Unexpected error", ex);
        var body = new ErrorResponse(500, "Internal Server Error", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static ErrorResponse badRequest(String message) {
        return new ErrorResponse(HttpStatus.BAD_REQUEST.value(), "Bad Request", message);
    }
}
