package com.naturalsql.web;

import com.naturalsql.api.ErrorResponse;
import com.naturalsql.exception.ErrorKind;
import com.naturalsql.exception.NaturalSqlException;
import com.naturalsql.exception.StatementRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(NaturalSqlException.class)
    public ResponseEntity<ErrorResponse> handlePipelineException(NaturalSqlException ex) {
        HttpStatus status = statusFor(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("Request failed (error_kind={}, status={}): {}", ex.getKind(), status.value(), ex.getMessage());
        } else {
            log.info("Request refused (error_kind={}, status={}): {}", ex.getKind(), status.value(), ex.getMessage());
        }

        String details = null;
        if (ex instanceof StatementRejectedException rejected) {
            details = rejected.getSql();
        }
        ErrorResponse error = ErrorResponse.builder()
                .errorKind(ex.getKind().name())
                .message(ex.getMessage())
                .details(details)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return badRequest("Input validation failed", details);
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadInput(Exception ex) {
        return badRequest(ex.getMessage(), null);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        ErrorResponse error = ErrorResponse.builder()
                .errorKind("NOT_FOUND")
                .message("Not found")
                .details(ex.getMessage())
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);

        ErrorResponse error = ErrorResponse.builder()
                .errorKind("INTERNAL_SERVER_ERROR")
                .message("An unexpected error occurred")
                .details(ex.getMessage())
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case DISALLOWED_STATEMENT_KIND, MISSING_FILTER_PREDICATE, UNPARAMETERIZED_LITERAL -> HttpStatus.BAD_REQUEST;
            case SESSION_NOT_FOUND, UNKNOWN_TABLE -> HttpStatus.NOT_FOUND;
            case BUSY, CONNECTION_INACTIVE, CANCELLED -> HttpStatus.CONFLICT;
            case COMPILATION_ERROR, LLM_DISABLED, CONNECTION_ERROR -> HttpStatus.BAD_GATEWAY;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case ENGINE_REJECTED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case EXECUTION_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private ResponseEntity<ErrorResponse> badRequest(String message, String details) {
        ErrorResponse error = ErrorResponse.builder()
                .errorKind("VALIDATION_FAILED")
                .message(message)
                .details(details)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }
}
