package com.pipewright.orchestrator.api;

import com.pipewright.orchestrator.api.dto.ErrorResponse;
import com.pipewright.orchestrator.executor.ExecutorException;
import com.pipewright.orchestrator.history.RecordNotFoundException;
import com.pipewright.orchestrator.history.ValidationException;
import com.pipewright.orchestrator.task.TaskNotFoundException;
import com.pipewright.orchestrator.tool.ToolException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions to HTTP status codes for both the process API and
 * the tool-call protocol.
 *
 * 400 : validation failures and bad tool arguments
 * 403 : scope violations
 * 404 : unknown process, task, tool or result
 * 502 : the execution service failed
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({ValidationException.class, IllegalArgumentException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> badRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "validation_error", ex, request);
    }

    @ExceptionHandler({RecordNotFoundException.class, TaskNotFoundException.class})
    public ResponseEntity<ErrorResponse> notFound(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex, request);
    }

    @ExceptionHandler(ToolException.class)
    public ResponseEntity<ErrorResponse> toolError(ToolException ex, HttpServletRequest request) {
        HttpStatus status = switch (ex.getKind()) {
            case INVALID_ARGUMENTS -> HttpStatus.BAD_REQUEST;
            case SCOPE_VIOLATION   -> HttpStatus.FORBIDDEN;
            case NOT_FOUND         -> HttpStatus.NOT_FOUND;
            case EXECUTION_ERROR   -> HttpStatus.BAD_GATEWAY;
        };
        return respond(status, ex.getKind().name().toLowerCase(), ex, request);
    }

    @ExceptionHandler(ExecutorException.class)
    public ResponseEntity<ErrorResponse> executorError(ExecutorException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_GATEWAY, "executor_error", ex, request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, Exception ex,
                                                  HttpServletRequest request) {
        log.warn("HTTP {} {} {}: {} ({})", status.value(), request.getMethod(), request.getRequestURI(),
                ex.getMessage(), ex.getClass().getSimpleName());
        return ResponseEntity.status(status).body(new ErrorResponse(error, ex.getMessage()));
    }
}
