package io.b2mash.b2b.isolation.exception;

import io.b2mash.b2b.isolation.provisioning.ProvisioningStep;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A provisioning step failed. Steps completed before it are kept, so calling provisioning again
 * for the same subdomain resumes at {@link #getFailedStep()}.
 */
public class ProvisioningException extends ErrorResponseException {

  private final ProvisioningStep failedStep;

  public ProvisioningException(ProvisioningStep failedStep, String detail, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(failedStep, detail), cause);
    this.failedStep = failedStep;
  }

  public ProvisioningStep getFailedStep() {
    return failedStep;
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(ProvisioningStep failedStep, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Provisioning failed");
    problem.setDetail(detail);
    problem.setProperty("failedStep", failedStep.name());
    return problem;
  }
}
