package io.b2mash.b2b.isolation.exception;

import io.b2mash.b2b.isolation.audit.AuditEventBuilder;
import io.b2mash.b2b.isolation.audit.AuditService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps isolation failures for any web layer built on top of this module. The {@code
 * ErrorResponseException} subtypes already carry their {@link ProblemDetail} and are rendered by
 * the base class.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final AuditService auditService;

  public GlobalExceptionHandler(AuditService auditService) {
    this.auditService = auditService;
  }

  @ExceptionHandler(TenantIsolationViolationException.class)
  public ResponseEntity<ProblemDetail> handleIsolationViolation(
      TenantIsolationViolationException ex, HttpServletRequest request) {
    log.warn(
        "Tenant access rejected: path={}, method={}, tenant={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getTenantIdentifier());

    auditService.log(
        AuditEventBuilder.builder()
            .action("security.tenant_access_rejected")
            .entityType("tenant")
            .entityId(String.valueOf(ex.getTenantIdentifier()))
            .tenantId(AuditEventBuilder.SYSTEM_TENANT)
            .details(Map.of("path", request.getRequestURI(), "method", request.getMethod()))
            .build());

    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ex.getBody());
  }

  @ExceptionHandler(CleanupFailureException.class)
  public ResponseEntity<ProblemDetail> handleCleanupFailure(CleanupFailureException ex) {
    log.error("Connection cleanup failed: {}", ex.getMessage(), ex);
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Internal error");
    problem.setDetail("The request completed but its connection could not be recycled");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  @ExceptionHandler(DataAccessResourceFailureException.class)
  public ResponseEntity<ProblemDetail> handleResourceFailure(
      DataAccessResourceFailureException ex) {
    log.error("Database resource failure: {}", ex.getMessage(), ex);
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Service unavailable");
    problem.setDetail("Tenant data is temporarily unavailable");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
  }
}
