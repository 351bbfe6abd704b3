package io.b2mash.b2b.isolation.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Idempotency guard on create paths: the schema or bucket is already there. */
public class ResourceAlreadyExistsException extends ErrorResponseException {

  private final String resourceType;
  private final String resourceName;

  public ResourceAlreadyExistsException(String resourceType, String resourceName) {
    this(resourceType, resourceName, null);
  }

  public ResourceAlreadyExistsException(
      String resourceType, String resourceName, Throwable cause) {
    super(HttpStatus.CONFLICT, createProblem(resourceType, resourceName), cause);
    this.resourceType = resourceType;
    this.resourceName = resourceName;
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getResourceName() {
    return resourceName;
  }

  @Override
  public String getMessage() {
    return resourceType + " '" + resourceName + "' already exists";
  }

  private static ProblemDetail createProblem(String resourceType, String resourceName) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(resourceType + " already exists");
    problem.setDetail(resourceType + " '" + resourceName + "' already exists");
    return problem;
  }
}
