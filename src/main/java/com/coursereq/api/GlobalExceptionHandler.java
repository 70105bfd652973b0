package com.coursereq.api;

import com.coursereq.domain.CourseNotFoundException;
import com.coursereq.domain.RequirementStorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Request bodies that are not JSON, or JSON that does not fit the catalog and import request
     * shapes. The offending location is reported as a dotted path, like validator errors.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                              HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        String message = "Malformed JSON request";

        if (ex.getMostSpecificCause() instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
            details.put("path", bodyPath(mapping));
            message = withoutSourceLocation(mapping.getOriginalMessage());
        } else if (ex.getMostSpecificCause() instanceof JsonProcessingException parsing) {
            message = withoutSourceLocation(parsing.getOriginalMessage());
        }
        return ErrorResponse.respond(HttpStatus.BAD_REQUEST, message, request, details);
    }

    @ExceptionHandler(CourseNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCourseNotFound(CourseNotFoundException ex, HttpServletRequest request) {
        return ErrorResponse.respond(HttpStatus.NOT_FOUND, ex.getMessage(), request, Map.of("course", ex.courseId()));
    }

    @ExceptionHandler(RequirementStorageException.class)
    public ResponseEntity<ErrorResponse> handleStorageFailure(RequirementStorageException ex, HttpServletRequest request) {
        log.error("Requirement storage failure: {}", ex.getMessage(), ex);
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex.getCause() != null) {
            details.put("cause", String.valueOf(ex.getCause().getMessage()));
        }
        if (ex.context() != null) {
            details.putAll(ex.context());
        }
        return ErrorResponse.respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request, details);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {}", request.getRequestURI(), ex);
        return ErrorResponse.respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request,
                Map.of("exception", ex.getClass().getName()));
    }

    private static String bodyPath(JsonMappingException ex) {
        return ex.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? "." + ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("", "body", ""));
    }

    private static String withoutSourceLocation(String message) {
        if (message == null) return "Malformed JSON request";
        int at = message.indexOf(" at [Source:");
        return at > 0 ? message.substring(0, at) : message;
    }
}
