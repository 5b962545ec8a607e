package org.example.biolearn.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.biolearn.config.RequestCorrelation;
import org.example.biolearn.model.ErrorResponse;
import org.example.biolearn.repository.StoreUnavailableException;
import org.example.biolearn.service.ChapterNotFoundException;
import org.example.biolearn.service.DuplicateSlugException;
import org.example.biolearn.service.InvalidContentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps content and store failures onto {@link ErrorResponse} bodies.
 * Client mistakes answer 400/404; everything else answers 500 with the failure text.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ChapterNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleChapterNotFound(ChapterNotFoundException ex, HttpServletRequest request) {
        log.warn("Chapter {} not found", ex.getSlug());
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    // A duplicate slug answers 400 rather than 409 to keep existing clients working.
    @ExceptionHandler(DuplicateSlugException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateSlug(DuplicateSlugException ex, HttpServletRequest request) {
        log.warn("Rejected chapter with existing slug {}", ex.getSlug());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidContentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidContent(InvalidContentException ex, HttpServletRequest request) {
        log.warn("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String detail = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(err -> toWireName(err.getField()) + ": " + err.getDefaultMessage())
                .sorted()
                .findFirst()
                .orElse("Validation error");
        log.warn("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), detail);
        return build(HttpStatus.BAD_REQUEST, detail, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable body on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return build(HttpStatus.BAD_REQUEST, "Malformed request body", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getName() + " has an invalid value", request);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException ex, HttpServletRequest request) {
        log.error("Document store failure on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException ex, HttpServletRequest request) {
        log.error("Unhandled failure on {} {}", request.getMethod(), request.getRequestURI(), ex);
        String detail = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return build(HttpStatus.INTERNAL_SERVER_ERROR, detail, request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String detail, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(
                status.name(),
                detail,
                status.value(),
                request.getRequestURI(),
                RequestCorrelation.resolveRequestId(request),
                Instant.now()
        );
        return ResponseEntity.status(status).body(body);
    }

    private static String toWireName(String field) {
        return switch (field) {
            case "chapterSlug" -> "chapter_slug";
            case "correctIndex" -> "correct_index";
            default -> field;
        };
    }
}
