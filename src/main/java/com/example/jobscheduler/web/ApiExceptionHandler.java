package com.example.jobscheduler.web;

import com.example.jobscheduler.service.ExecutionLedgerException;
import com.example.jobscheduler.service.InvalidScheduleException;
import com.example.jobscheduler.service.JobNotFoundException;
import com.example.jobscheduler.service.UnknownServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import javax.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 统一错误体：{error, message, statusCode}。
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(JobNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "Job not found", e.getMessage());
    }

    @ExceptionHandler(InvalidScheduleException.class)
    public ResponseEntity<Map<String, Object>> invalidCron(InvalidScheduleException e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid cron expression", e.getMessage());
    }

    @ExceptionHandler(UnknownServiceException.class)
    public ResponseEntity<Map<String, Object>> unknownService(UnknownServiceException e) {
        return error(HttpStatus.BAD_REQUEST, "Unknown service", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidBody(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(ApiExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "Validation failed", msg);
    }

    @ExceptionHandler({ConstraintViolationException.class, IllegalArgumentException.class,
            HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> badRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "Bad request", safeMsg(e.getMessage()));
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<Map<String, Object>> saturated(TaskRejectedException e) {
        log.error("Dispatch pool saturated: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Dispatch queue full", "Too many executions in flight, retry later");
    }

    @ExceptionHandler(ExecutionLedgerException.class)
    public ResponseEntity<Map<String, Object>> ledger(ExecutionLedgerException e) {
        log.error("Execution ledger failure", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Execution ledger unavailable", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> unexpected(Exception e) {
        log.error("Unhandled error", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", safeMsg(e.getMessage()));
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("statusCode", status.value());
        return ResponseEntity.status(status).body(body);
    }

    private static String describe(FieldError fe) {
        return fe.getField() + " " + fe.getDefaultMessage();
    }

    private static String safeMsg(String msg) {
        if (msg == null) return "";
        msg = msg.replaceAll("\\s+", " ").trim();
        return msg.length() > 500 ? msg.substring(0, 500) + "..." : msg;
    }
}
