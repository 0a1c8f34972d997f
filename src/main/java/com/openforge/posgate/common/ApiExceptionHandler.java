package com.openforge.posgate.common;

import com.openforge.posgate.audit.AuditEntry;
import com.openforge.posgate.audit.AuditRecorder;
import com.openforge.posgate.domain.AuditAction;
import com.openforge.posgate.domain.AuditLog;
import com.openforge.posgate.domain.User;
import com.openforge.posgate.monitor.MonitorEvent;
import com.openforge.posgate.monitor.MonitorEventBus;
import com.openforge.posgate.monitor.RequestLifecycleFilter;
import com.openforge.posgate.rbac.CurrentPrincipal;
import com.openforge.posgate.rbac.Principal;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps every failure to the error envelope.
 *
 *   ApiException          → its own code and status
 *   bad input             → VALIDATION_ERROR
 *   anything else         → INTERNAL_ERROR with a generic message, plus a
 *                           SYSTEM_ERROR audit entry
 *
 * Every error response also goes out as an ERROR event on the monitor bus.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private final AuditRecorder   auditRecorder;
    private final MonitorEventBus monitorBus;
    private final boolean         exposeDetails;

    public ApiExceptionHandler(AuditRecorder auditRecorder,
                               MonitorEventBus monitorBus,
                               @Value("${pos.errors.expose-details:false}") boolean exposeDetails) {
        this.auditRecorder = auditRecorder;
        this.monitorBus    = monitorBus;
        this.exposeDetails = exposeDetails;
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApi(ApiException e, HttpServletRequest request) {
        publishError(request, e.getCode().getStatus().value(), e.getCode(), e.getMessage());
        return ResponseEntity.status(e.getCode().getStatus()).body(ApiResponse.error(e));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidBody(MethodArgumentNotValidException e,
                                                               HttpServletRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return validationError(request, "Validation failed", Map.of("fields", fields));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(Exception e, HttpServletRequest request) {
        String message = e instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : e.getMessage();
        return validationError(request, message, null);
    }

    /** Framework-level 4xx such as unknown routes or unsupported methods. */
    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleFramework(Exception e, HttpServletRequest request) {
        HttpStatusCode status = ((ErrorResponse) e).getStatusCode();
        ErrorCode code = status.value() == HttpStatus.NOT_FOUND.value()
                ? ErrorCode.NOT_FOUND
                : ErrorCode.VALIDATION_ERROR;
        String message = ((ErrorResponse) e).getBody().getDetail();
        publishError(request, status.value(), code, message);
        return ResponseEntity.status(status)
                .body(ApiResponse.error(code, message == null ? code.getDefaultMessage() : message, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("[Error] Unhandled exception on {} {}", request.getMethod(), request.getRequestURI(), e);

        Principal principal = CurrentPrincipal.find().orElse(null);
        String    detail    = e.getClass().getSimpleName() + ": " + e.getMessage();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("path", request.getRequestURI());
        details.put("method", request.getMethod());
        details.put("exception", e.getClass().getName());

        AuditEntry.AuditEntryBuilder entry = principal == null
                ? AuditEntry.builder().tenantId(User.GLOBAL_TENANT).action(AuditAction.SYSTEM_ERROR)
                : AuditEntry.by(principal, AuditAction.SYSTEM_ERROR);
        auditRecorder.record(entry
                .resourceType("system")
                .details(details)
                .status(AuditLog.Status.FAILURE)
                .errorMessage(detail)
                .build());

        String message = exposeDetails ? detail : ErrorCode.INTERNAL_ERROR.getDefaultMessage();
        publishError(request, HttpStatus.INTERNAL_SERVER_ERROR.value(), ErrorCode.INTERNAL_ERROR, message);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(ErrorCode.INTERNAL_ERROR, message, null));
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private ResponseEntity<ApiResponse<Void>> validationError(HttpServletRequest request,
                                                              String message,
                                                              Map<String, Object> details) {
        publishError(request, HttpStatus.BAD_REQUEST.value(), ErrorCode.VALIDATION_ERROR, message);
        return ResponseEntity.badRequest().body(ApiResponse.error(ErrorCode.VALIDATION_ERROR, message, details));
    }

    private void publishError(HttpServletRequest request, int status, ErrorCode code, String message) {
        Principal principal = CurrentPrincipal.find().orElse(null);
        Object    requestId = request.getAttribute(RequestLifecycleFilter.REQUEST_ID_ATTRIBUTE);
        monitorBus.publish(MonitorEvent.error(
                requestId == null ? null : requestId.toString(),
                request.getMethod(),
                request.getRequestURI(),
                principal == null ? null : principal.tenantId(),
                principal == null ? null : principal.userId(),
                status,
                code.name(),
                message));
    }
}
