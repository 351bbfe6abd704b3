package io.b2mash.b2b.isolation.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when tenant-scoped access is attempted for a tenant the registry does not know. Treated
 * as a security event: callers must never swallow it.
 */
public class TenantIsolationViolationException extends ErrorResponseException {

  private final String tenantIdentifier;

  public TenantIsolationViolationException(String tenantIdentifier) {
    super(HttpStatus.NOT_FOUND, createProblem(tenantIdentifier), null);
    this.tenantIdentifier = tenantIdentifier;
  }

  public String getTenantIdentifier() {
    return tenantIdentifier;
  }

  @Override
  public String getMessage() {
    return "Tenant '" + tenantIdentifier + "' not found or invalid";
  }

  private static ProblemDetail createProblem(String tenantIdentifier) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Tenant not found");
    problem.setDetail("Tenant '" + tenantIdentifier + "' not found or invalid");
    return problem;
  }
}
