package io.b2mash.b2b.isolation.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a subdomain or tenant identifier cannot be turned into a safe namespace token. */
public class InvalidIdentifierException extends ErrorResponseException {

  private final String reason;

  public InvalidIdentifierException(String reason) {
    super(HttpStatus.BAD_REQUEST, createProblem(reason), null);
    this.reason = reason;
  }

  public String getReason() {
    return reason;
  }

  @Override
  public String getMessage() {
    return "Invalid identifier: " + reason;
  }

  private static ProblemDetail createProblem(String reason) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid identifier");
    problem.setDetail(reason);
    return problem;
  }
}
