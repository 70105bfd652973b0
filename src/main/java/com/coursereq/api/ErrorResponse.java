package com.coursereq.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.OffsetDateTime;
import java.util.Map;

/** Body of every non-2xx answer from the requirements API. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(OffsetDateTime timestamp,
                            int status,
                            String error,
                            String message,
                            String path,
                            Map<String, Object> details) {

    static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, HttpServletRequest request,
                                                 Map<String, Object> details) {
        ErrorResponse body = new ErrorResponse(OffsetDateTime.now(), status.value(), status.getReasonPhrase(),
                message, request.getRequestURI(), details == null || details.isEmpty() ? null : Map.copyOf(details));
        return ResponseEntity.status(status).body(body);
    }
}
